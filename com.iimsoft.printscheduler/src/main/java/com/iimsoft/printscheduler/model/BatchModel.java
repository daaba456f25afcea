package com.iimsoft.printscheduler.model;

import java.util.List;
import java.util.stream.Collectors;

import com.iimsoft.printscheduler.domain.JobBatch;
import com.iimsoft.printscheduler.domain.PrinterRoster;

/**
 * 一个批次的完整模型描述，与具体求解器无关：
 * 变量值域（{@link JobSlot}）、每台打印机的互斥组、邻近完工惩罚的比较对、目标权重和时间窗。
 * 求解器实现把它翻译成各自的建模方式。
 */
public class BatchModel {

    private final JobBatch batch;
    private final PrinterRoster roster;
    private final HorizonEstimate horizonEstimate;
    private final int shiftStart;
    private final List<JobSlot> slots;
    private final List<NoOverlapGroup> noOverlapGroups;
    private final List<ProximityPair> proximityPairs;
    private final ObjectiveWeights weights;

    public BatchModel(JobBatch batch, PrinterRoster roster, HorizonEstimate horizonEstimate, int shiftStart,
                      List<JobSlot> slots, List<NoOverlapGroup> noOverlapGroups,
                      List<ProximityPair> proximityPairs, ObjectiveWeights weights) {
        this.batch = batch;
        this.roster = roster;
        this.horizonEstimate = horizonEstimate;
        this.shiftStart = shiftStart;
        this.slots = List.copyOf(slots);
        this.noOverlapGroups = List.copyOf(noOverlapGroups);
        this.proximityPairs = List.copyOf(proximityPairs);
        this.weights = weights;
    }

    /**
     * 所有任务的 start 值域都非空。否则不用调用求解器就可判定无解。
     */
    public boolean isStructurallyFeasible() {
        return slots.stream().allMatch(JobSlot::hasStartDomain);
    }

    public List<JobSlot> getSlotsWithoutStartDomain() {
        return slots.stream().filter(s -> !s.hasStartDomain()).collect(Collectors.toList());
    }

    public JobSlot getSlot(int index) {
        return slots.get(index);
    }

    public int getBatchNumber() {
        return batch.getNumber();
    }

    public int getHorizon() {
        return horizonEstimate.getHorizon();
    }

    public JobBatch getBatch() { return batch; }
    public PrinterRoster getRoster() { return roster; }
    public HorizonEstimate getHorizonEstimate() { return horizonEstimate; }
    public int getShiftStart() { return shiftStart; }
    public List<JobSlot> getSlots() { return slots; }
    public List<NoOverlapGroup> getNoOverlapGroups() { return noOverlapGroups; }
    public List<ProximityPair> getProximityPairs() { return proximityPairs; }
    public ObjectiveWeights getWeights() { return weights; }

    @Override
    public String toString() {
        return "BatchModel{batch " + batch.getNumber() + ", " + slots.size() + " slots, " + noOverlapGroups.size()
                + " printers, " + proximityPairs.size() + " proximity pairs, horizon " + getHorizon() + "}";
    }
}
