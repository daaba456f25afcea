package com.iimsoft.printscheduler.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.iimsoft.printscheduler.config.SchedulingParameters;
import com.iimsoft.printscheduler.domain.Printer;
import com.iimsoft.printscheduler.domain.PrinterRoster;

/**
 * 组合目标函数并计算具体解的各项取值。
 *
 * 目标项：
 * 1) makespan：max(start + 名义时长)，不含缓冲；
 * 2) 邻近完工惩罚：窗口内同工艺、完工时间相差不超过阈值且机架不同的任务对数；
 * 3) 负载均衡：单台打印机上的最大任务数；
 * 4) 开工时间和：轻权重，使同分解偏向靠前排；
 * 5) 使用的打印机数：仅 {@link ObjectiveType#MAKESPAN_AND_PRINTERS} 使用。
 */
public class ObjectiveComposer {

    private final SchedulingParameters parameters;

    public ObjectiveComposer(SchedulingParameters parameters) {
        this.parameters = parameters;
    }

    public ObjectiveWeights compose(int printerCount) {
        switch (parameters.getObjectiveType()) {
            case MAKESPAN_AND_PRINTERS:
                return new ObjectiveWeights(printerCount + 1L, 0L, 0L, 1L, 1L);
            case OPERATOR_AWARE_COMPOSITE:
            default:
                return new ObjectiveWeights(parameters.getMakespanWeight(), parameters.getProximityPenaltyWeight(),
                        parameters.getLoadBalanceWeight(), parameters.getTieBreakWeight(), 0L);
        }
    }

    public ProximityWindow proximityWindow() {
        return new ProximityWindow(parameters.getProximityLookahead(), parameters.getProximityDurationGapMinutes(),
                parameters.getProximityThresholdMinutes());
    }

    /**
     * 计算一个完整解的各目标项，供日志诊断、结果报告和校验使用。
     */
    public static ObjectiveBreakdown evaluate(BatchModel model, List<SlotAssignment> assignments) {
        PrinterRoster roster = model.getRoster();
        long[] trueEnd = new long[model.getSlots().size()];
        int[] rackId = new int[model.getSlots().size()];
        Map<Long, Long> jobsPerPrinter = new HashMap<>();

        long makespan = 0L;
        long totalStart = 0L;
        for (SlotAssignment a : assignments) {
            JobSlot slot = model.getSlot(a.getSlotIndex());
            Printer printer = roster.getPrinter(a.getPrinterId());
            trueEnd[a.getSlotIndex()] = a.getStart() + slot.getNominalDuration();
            rackId[a.getSlotIndex()] = roster.rackIdOf(printer);
            makespan = Math.max(makespan, trueEnd[a.getSlotIndex()]);
            totalStart += a.getStart();
            jobsPerPrinter.merge(a.getPrinterId(), 1L, Long::sum);
        }

        long penalty = 0L;
        for (ProximityPair pair : model.getProximityPairs()) {
            boolean sameRack = rackId[pair.getLeftSlot()] == rackId[pair.getRightSlot()];
            if (pair.penalizes(trueEnd[pair.getLeftSlot()], trueEnd[pair.getRightSlot()], sameRack)) {
                penalty++;
            }
        }
        long maxLoad = jobsPerPrinter.values().stream().mapToLong(Long::longValue).max().orElse(0L);
        long printersUsed = jobsPerPrinter.size();

        ObjectiveWeights w = model.getWeights();
        long total = w.getMakespanWeight() * makespan
                + w.getProximityWeight() * penalty
                + w.getLoadBalanceWeight() * maxLoad
                + w.getTieBreakWeight() * totalStart
                + w.getPrinterUsageWeight() * printersUsed;
        return new ObjectiveBreakdown(makespan, penalty, maxLoad, totalStart, printersUsed, total);
    }
}
