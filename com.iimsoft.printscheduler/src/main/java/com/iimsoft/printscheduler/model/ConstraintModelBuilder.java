package com.iimsoft.printscheduler.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.iimsoft.printscheduler.config.SchedulingParameters;
import com.iimsoft.printscheduler.domain.JobBatch;
import com.iimsoft.printscheduler.domain.PrintJob;
import com.iimsoft.printscheduler.domain.Printer;
import com.iimsoft.printscheduler.domain.PrinterRoster;
import com.iimsoft.printscheduler.exception.UnroutableJobException;

/**
 * 为一个批次声明变量和硬约束，生成 {@link BatchModel}。
 *
 * 硬约束只有三类：每台打印机上区间互斥、兼容性（通过值域限制）、时间窗包含。
 * 目标函数只在可行解之间排序，不影响可行性。
 */
public class ConstraintModelBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintModelBuilder.class);

    private final PrinterRoster roster;
    private final SchedulingParameters parameters;
    private final ObjectiveComposer objectiveComposer;

    public ConstraintModelBuilder(PrinterRoster roster, SchedulingParameters parameters,
                                  ObjectiveComposer objectiveComposer) {
        this.roster = roster;
        this.parameters = parameters;
        this.objectiveComposer = objectiveComposer;
    }

    public BatchModel build(JobBatch batch, HorizonEstimate horizonEstimate) {
        int horizon = horizonEstimate.getHorizon();
        int shiftStart = parameters.getShiftStartMinutes();
        int buffer = parameters.getJobBufferMinutes();

        List<PrintJob> unroutable = new ArrayList<>();
        List<JobSlot> slots = new ArrayList<>();
        for (PrintJob job : batch.getJobs()) {
            List<Printer> compatible = roster.compatiblePrinters(job);
            if (compatible.isEmpty()) {
                unroutable.add(job);
                continue;
            }
            int effectiveDuration = job.getDurationMinutes() + buffer;
            slots.add(new JobSlot(slots.size(), job, effectiveDuration, shiftStart, horizon - effectiveDuration,
                    compatible));
        }
        if (!unroutable.isEmpty()) {
            throw new UnroutableJobException(unroutable);
        }

        // 每台打印机收集可能用到它的任务，作为可选区间参与互斥
        Map<Printer, List<Integer>> candidatesByPrinter = new LinkedHashMap<>();
        for (Printer printer : roster.getPrinters()) {
            candidatesByPrinter.put(printer, new ArrayList<>());
        }
        for (JobSlot slot : slots) {
            for (Printer printer : slot.getCompatiblePrinters()) {
                candidatesByPrinter.get(printer).add(slot.getIndex());
            }
        }
        List<NoOverlapGroup> groups = candidatesByPrinter.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(e -> new NoOverlapGroup(e.getKey(), e.getValue()))
                .collect(Collectors.toList());

        ObjectiveWeights weights = objectiveComposer.compose(roster.size());
        List<ProximityPair> pairs = weights.usesProximity()
                ? objectiveComposer.proximityWindow().pairs(slots)
                : List.of();

        BatchModel model = new BatchModel(batch, roster, horizonEstimate, shiftStart, slots, groups, pairs, weights);
        if (buffer > 0) {
            LOGGER.debug("Applying a buffer of {} minutes between jobs", buffer);
        }
        LOGGER.debug("Built {}", model);
        return model;
    }
}
