package com.iimsoft.printscheduler.solver.optaplanner;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;
import org.optaplanner.core.api.solver.Solver;
import org.optaplanner.core.api.solver.SolverFactory;
import org.optaplanner.core.config.solver.SolverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.iimsoft.printscheduler.domain.Printer;
import com.iimsoft.printscheduler.model.BatchModel;
import com.iimsoft.printscheduler.model.JobSlot;
import com.iimsoft.printscheduler.model.SlotAssignment;
import com.iimsoft.printscheduler.solver.ConstraintSolver;
import com.iimsoft.printscheduler.solver.SolveOutcome;
import com.iimsoft.printscheduler.solver.SolveStatus;

/**
 * 默认求解引擎：把 {@link BatchModel} 转成 {@link PrintSchedule} 交给 OptaPlanner 局部搜索。
 *
 * 局部搜索无法证明最优或无解，所以只会返回 FEASIBLE 或 UNKNOWN。
 */
public class OptaPlannerConstraintSolver implements ConstraintSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(OptaPlannerConstraintSolver.class);

    @Override
    public SolveOutcome solve(BatchModel model, Duration timeLimit) {
        PrintSchedule problem = toProblem(model);

        SolverFactory<PrintSchedule> solverFactory = SolverFactory.create(new SolverConfig()
                .withSolutionClass(PrintSchedule.class)
                .withEntityClasses(JobAllocation.class)
                .withConstraintProviderClass(PrintScheduleConstraintProvider.class)
                .withTerminationSpentLimit(timeLimit));
        Solver<PrintSchedule> solver = solverFactory.buildSolver();

        long begin = System.nanoTime();
        PrintSchedule solution = solver.solve(problem);
        Duration wallTime = Duration.ofNanos(System.nanoTime() - begin);

        HardSoftLongScore score = solution.getScore();
        LOGGER.debug("Batch {} best score {}", model.getBatchNumber(), score);
        if (score == null || !score.isSolutionInitialized()) {
            return SolveOutcome.noSolution(SolveStatus.UNKNOWN, wallTime, "solution not initialized: " + score);
        }
        if (!score.isFeasible()) {
            return SolveOutcome.noSolution(SolveStatus.UNKNOWN, wallTime, "hard constraints broken: " + score);
        }

        List<SlotAssignment> assignments = new ArrayList<>();
        for (JobAllocation allocation : solution.getAllocationList()) {
            if (!allocation.isAssigned()) {
                return SolveOutcome.noSolution(SolveStatus.UNKNOWN, wallTime, allocation + " not assigned");
            }
            assignments.add(new SlotAssignment(allocation.getSlotIndex(), allocation.getPrinter().getId(),
                    allocation.getStart(), allocation.getEnd()));
        }
        return SolveOutcome.solved(SolveStatus.FEASIBLE, assignments, wallTime, "score " + score);
    }

    static PrintSchedule toProblem(BatchModel model) {
        List<JobAllocation> allocations = new ArrayList<>();
        for (JobSlot slot : model.getSlots()) {
            allocations.add(new JobAllocation(slot));
        }
        List<Printer> printers = new ArrayList<>(model.getRoster().getPrinters());
        return new PrintSchedule(printers, new ArrayList<>(model.getProximityPairs()), model.getWeights(), allocations);
    }

    @Override
    public String getName() {
        return "OptaPlanner";
    }
}
