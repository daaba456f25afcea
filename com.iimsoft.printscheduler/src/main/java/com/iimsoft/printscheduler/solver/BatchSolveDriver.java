package com.iimsoft.printscheduler.solver;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.iimsoft.printscheduler.domain.Printer;
import com.iimsoft.printscheduler.domain.ScheduledJob;
import com.iimsoft.printscheduler.exception.BatchInfeasibleException;
import com.iimsoft.printscheduler.model.BatchModel;
import com.iimsoft.printscheduler.model.JobSlot;
import com.iimsoft.printscheduler.model.ObjectiveBreakdown;
import com.iimsoft.printscheduler.model.ObjectiveComposer;
import com.iimsoft.printscheduler.model.SlotAssignment;

/**
 * 求解一个批次并提取结果：整批成功，或者抛出 {@link BatchInfeasibleException}。
 *
 * 求解器返回的解在这里再校验一遍（兼容性、时间窗、同机互斥），不通过同样视为无解。
 */
public class BatchSolveDriver {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchSolveDriver.class);

    private final ConstraintSolver solver;
    private final Duration timeLimit;

    public BatchSolveDriver(ConstraintSolver solver, Duration timeLimit) {
        this.solver = solver;
        this.timeLimit = timeLimit;
    }

    public BatchSolution solve(BatchModel model) {
        int batchNumber = model.getBatchNumber();
        if (!model.isStructurallyFeasible()) {
            throw new BatchInfeasibleException(batchNumber, "jobs do not fit in the horizon of "
                    + model.getHorizon() + " min: " + model.getSlotsWithoutStartDomain());
        }

        SolveOutcome outcome;
        try {
            outcome = solver.solve(model, timeLimit);
        } catch (RuntimeException | LinkageError e) {
            LOGGER.error("Solver {} failed on batch {}", solver.getName(), batchNumber, e);
            throw new BatchInfeasibleException(batchNumber, solver.getName() + " failed: " + e.getMessage(), e);
        }
        LOGGER.info("Batch {}: {} returned {}", batchNumber, solver.getName(), outcome);
        if (!outcome.getStatus().hasSolution()) {
            throw new BatchInfeasibleException(batchNumber, "no solution found (" + outcome + ")");
        }

        List<SlotAssignment> assignments = outcome.getAssignments();
        verify(model, assignments);

        List<ScheduledJob> scheduled = new ArrayList<>();
        for (SlotAssignment a : assignments) {
            JobSlot slot = model.getSlot(a.getSlotIndex());
            Printer printer = model.getRoster().getPrinter(a.getPrinterId());
            scheduled.add(new ScheduledJob(slot.getJob(), printer, batchNumber, a.getStart(), a.getEnd()));
        }
        ObjectiveBreakdown objective = ObjectiveComposer.evaluate(model, assignments);
        LOGGER.debug("Batch {} objective: {}", batchNumber, objective);
        if (LOGGER.isDebugEnabled()) {
            logPrinterUsage(model, scheduled);
        }
        return new BatchSolution(model, outcome, scheduled, objective);
    }

    private void verify(BatchModel model, List<SlotAssignment> assignments) {
        int batchNumber = model.getBatchNumber();
        if (assignments.size() != model.getSlots().size()) {
            throw new BatchInfeasibleException(batchNumber, "solver assigned " + assignments.size() + " of "
                    + model.getSlots().size() + " jobs");
        }
        Set<Integer> seen = new HashSet<>();
        for (SlotAssignment a : assignments) {
            if (a.getSlotIndex() < 0 || a.getSlotIndex() >= model.getSlots().size() || !seen.add(a.getSlotIndex())) {
                throw new BatchInfeasibleException(batchNumber, "invalid or duplicate slot " + a.getSlotIndex());
            }
            JobSlot slot = model.getSlot(a.getSlotIndex());
            boolean compatible = slot.getCompatiblePrinters().stream().anyMatch(p -> p.getId() == a.getPrinterId());
            if (!compatible) {
                throw new BatchInfeasibleException(batchNumber, "job " + slot.getJob().getId()
                        + " assigned to incompatible printer " + a.getPrinterId());
            }
            if (a.getStart() < slot.getStartMin() || a.getStart() > slot.getStartMax()
                    || a.getEnd() != a.getStart() + slot.getEffectiveDuration()) {
                throw new BatchInfeasibleException(batchNumber, "job " + slot.getJob().getId()
                        + " placed outside its horizon: [" + a.getStart() + ", " + a.getEnd() + ")");
            }
        }

        Map<Long, List<SlotAssignment>> byPrinter = assignments.stream()
                .collect(Collectors.groupingBy(SlotAssignment::getPrinterId));
        for (Map.Entry<Long, List<SlotAssignment>> e : byPrinter.entrySet()) {
            List<SlotAssignment> onPrinter = new ArrayList<>(e.getValue());
            onPrinter.sort(Comparator.comparingLong(SlotAssignment::getStart));
            for (int i = 1; i < onPrinter.size(); i++) {
                if (onPrinter.get(i).getStart() < onPrinter.get(i - 1).getEnd()) {
                    throw new BatchInfeasibleException(batchNumber, "overlapping jobs on printer " + e.getKey()
                            + ": slots " + onPrinter.get(i - 1).getSlotIndex() + " and " + onPrinter.get(i).getSlotIndex());
                }
            }
        }
    }

    private void logPrinterUsage(BatchModel model, List<ScheduledJob> scheduled) {
        Set<Long> used = scheduled.stream().map(s -> s.getPrinter().getId()).collect(Collectors.toSet());
        for (Printer printer : model.getRoster().getPrinters()) {
            LOGGER.debug("Printer {} ({} - {} {}) was {}", printer.getId(), printer.getName(),
                    printer.getTechnology(), printer.getMaterial(), used.contains(printer.getId()) ? "USED" : "NOT USED");
        }
        LOGGER.debug("Total printers used: {} out of {}", used.size(), model.getRoster().size());
    }

    public ConstraintSolver getSolver() {
        return solver;
    }
}
