package com.iimsoft.printscheduler.solver.cpsat;

import static com.iimsoft.printscheduler.TestFixtures.core;
import static com.iimsoft.printscheduler.TestFixtures.coreJob;
import static com.iimsoft.printscheduler.TestFixtures.fastParameters;
import static com.iimsoft.printscheduler.TestFixtures.roster;
import static com.iimsoft.printscheduler.TestFixtures.xl;
import static com.iimsoft.printscheduler.TestFixtures.xlJob;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.iimsoft.printscheduler.config.SchedulingParameters;
import com.iimsoft.printscheduler.domain.JobBatch;
import com.iimsoft.printscheduler.domain.PrintJob;
import com.iimsoft.printscheduler.domain.PrinterRoster;
import com.iimsoft.printscheduler.domain.ScheduledJob;
import com.iimsoft.printscheduler.model.BatchModel;
import com.iimsoft.printscheduler.model.ConstraintModelBuilder;
import com.iimsoft.printscheduler.model.HorizonEstimator;
import com.iimsoft.printscheduler.model.ObjectiveComposer;
import com.iimsoft.printscheduler.solver.BatchSolution;
import com.iimsoft.printscheduler.solver.BatchSolveDriver;
import com.iimsoft.printscheduler.solver.SolveStatus;

class CpSatConstraintSolverTest {

    @BeforeAll
    static void requireNativeLibrary() {
        boolean loaded;
        try {
            CpSatConstraintSolver.ensureNativeLoaded();
            loaded = true;
        } catch (RuntimeException | LinkageError e) {
            loaded = false;
        }
        Assumptions.assumeTrue(loaded, "OR-Tools native library not available on this host");
    }

    @Test
    void serializesThreeJobsFromShiftStart() {
        PrinterRoster roster = roster(core(1, "PETG", "2"));

        BatchSolution solution = solve(roster, fastParameters(), List.of(
                coreJob(1, "A", "PETG", 30), coreJob(2, "B", "PETG", 30), coreJob(3, "C", "PETG", 30)));

        assertEquals(SolveStatus.OPTIMAL, solution.getOutcome().getStatus());
        Set<Long> starts = solution.getScheduledJobs().stream().map(ScheduledJob::getStart).collect(Collectors.toSet());
        assertEquals(Set.of(480L, 510L, 540L), starts);
    }

    @Test
    void heavyProximityWeightSpreadsEndsAcrossRacks() {
        // 两个任务只能分别去不同机架上的打印机
        PrinterRoster roster = roster(core(1, "PETG", "1"), xl(2, "PETG", "2"));
        SchedulingParameters parameters = fastParameters();
        parameters.setProximityThresholdMinutes(15);
        parameters.setProximityPenaltyWeight(1000);

        BatchSolution solution = solve(roster, parameters, List.of(
                coreJob(1, "A", "PETG", 60), xlJob(2, "B", "PETG", 60)));

        assertEquals(0, solution.getProximityPenalty());
        List<ScheduledJob> jobs = solution.getScheduledJobs();
        assertTrue(Math.abs(jobs.get(0).getTrueEnd() - jobs.get(1).getTrueEnd()) > 15);
    }

    @Test
    void lightProximityWeightAcceptsThePenalty() {
        PrinterRoster roster = roster(core(1, "PETG", "1"), xl(2, "PETG", "2"));
        SchedulingParameters parameters = fastParameters();
        parameters.setProximityThresholdMinutes(15);

        BatchSolution solution = solve(roster, parameters, List.of(
                coreJob(1, "A", "PETG", 60), xlJob(2, "B", "PETG", 60)));

        // 错开 16 分钟的代价 (makespan + 开工时间) 大于惩罚 5
        assertEquals(1, solution.getProximityPenalty());
        assertEquals(540, solution.getObjective().getMakespan());
    }

    private static BatchSolution solve(PrinterRoster roster, SchedulingParameters parameters, List<PrintJob> jobs) {
        JobBatch batch = new JobBatch(1, jobs);
        BatchModel model = new ConstraintModelBuilder(roster, parameters, new ObjectiveComposer(parameters))
                .build(batch, new HorizonEstimator(roster, parameters).estimate(jobs));
        return new BatchSolveDriver(new CpSatConstraintSolver(), parameters.getSolveTimeLimit()).solve(model);
    }
}
