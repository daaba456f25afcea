package com.iimsoft.printscheduler.service;

import static com.iimsoft.printscheduler.TestFixtures.core;
import static com.iimsoft.printscheduler.TestFixtures.coreJob;
import static com.iimsoft.printscheduler.TestFixtures.roster;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import com.iimsoft.printscheduler.batch.GreedyTitleBatchPartitioner;
import com.iimsoft.printscheduler.config.SchedulingParameters;
import com.iimsoft.printscheduler.config.UnroutablePolicy;
import com.iimsoft.printscheduler.domain.PrintJob;
import com.iimsoft.printscheduler.domain.Printer;
import com.iimsoft.printscheduler.domain.PrinterRoster;
import com.iimsoft.printscheduler.domain.ScheduledJob;
import com.iimsoft.printscheduler.domain.UnscheduledJob;
import com.iimsoft.printscheduler.exception.SchedulingConfigurationException;
import com.iimsoft.printscheduler.exception.UnroutableJobException;
import com.iimsoft.printscheduler.model.BatchModel;
import com.iimsoft.printscheduler.model.JobSlot;
import com.iimsoft.printscheduler.model.SlotAssignment;
import com.iimsoft.printscheduler.solver.ConstraintSolver;
import com.iimsoft.printscheduler.solver.SolveOutcome;
import com.iimsoft.printscheduler.solver.SolveStatus;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MultiBatchOrchestratorTest {

    // 单台打印机：批次容量 = 720 分钟，每个 400 分钟的任务自成一批
    private final PrinterRoster roster = roster(core(1, "PETG", "2"));
    private final List<PrintJob> jobs = List.of(
            coreJob(1, "A", "PETG", 400), coreJob(2, "B", "PETG", 400), coreJob(3, "C", "PETG", 400));

    @Mock
    private ConstraintSolver solver;

    private SchedulingParameters parameters;

    @BeforeEach
    void setUp() {
        parameters = new SchedulingParameters();
        when(solver.getName()).thenReturn("serial");
        when(solver.solve(any(), any())).thenAnswer(inv -> serialize(inv.getArgument(0)));
    }

    @Test
    void solvedBatchesAreOffsetByTwoShifts() {
        ScheduleResult result = orchestrator().run(jobs);

        assertTrue(result.isComplete());
        assertEquals(Map.of(1L, 480L, 2L, 1920L, 3L, 3360L), startsById(result));
        assertEquals(List.of(0L, 1440L, 2880L), result.getBatchReports().stream()
                .map(BatchReport::getOffsetMinutes).collect(Collectors.toList()));
        assertEquals(3360 + 400, result.getMakespan());
    }

    @Test
    void failedBatchIsIsolatedAndDoesNotAdvanceTheOffset() {
        doAnswer(inv -> {
            BatchModel model = inv.getArgument(0);
            if (model.getBatchNumber() == 1) {
                return SolveOutcome.noSolution(SolveStatus.INFEASIBLE, Duration.ZERO, "no room");
            }
            return serialize(model);
        }).when(solver).solve(any(), any());

        ScheduleResult result = orchestrator().run(jobs);

        assertEquals(Map.of(2L, 480L, 3L, 1920L), startsById(result));
        assertEquals(1, result.getUnscheduledJobs().size());
        UnscheduledJob failed = result.getUnscheduledJobs().get(0);
        assertEquals(1L, failed.getJob().getId());
        assertEquals(UnscheduledJob.Reason.BATCH_INFEASIBLE, failed.getReason());
        assertEquals(1, failed.getBatchNumber());
        assertEquals(BatchState.FAILED, result.getBatchReports().get(0).getState());
        assertNull(result.getBatchReports().get(0).getOffsetMinutes());
    }

    @Test
    void jobWithoutCompatiblePrinterIsOnlyUnscheduled() {
        List<PrintJob> withAbs = new ArrayList<>(jobs);
        withAbs.add(coreJob(4, "Washer", "ABS", 40));

        ScheduleResult result = orchestrator().run(withAbs);

        assertEquals(3, result.getScheduledJobs().size());
        assertTrue(result.getScheduledJobs().stream().noneMatch(s -> s.getJob().getId() == 4L));
        UnscheduledJob abs = result.getUnscheduledJobs().get(0);
        assertEquals(4L, abs.getJob().getId());
        assertEquals(UnscheduledJob.Reason.UNROUTABLE, abs.getReason());
        assertNull(abs.getBatchNumber());

        ArgumentCaptor<BatchModel> models = ArgumentCaptor.forClass(BatchModel.class);
        verify(solver, atLeastOnce()).solve(models.capture(), any());
        for (BatchModel model : models.getAllValues()) {
            assertTrue(model.getSlots().stream().noneMatch(slot -> slot.getJob().getId() == 4L));
        }
    }

    @Test
    void failPolicyStopsBeforeAnyBatch() {
        parameters.setUnroutablePolicy(UnroutablePolicy.FAIL);

        assertThrows(UnroutableJobException.class,
                () -> orchestrator().run(List.of(coreJob(1, "A", "PETG", 30), coreJob(4, "Washer", "ABS", 40))));
        verify(solver, never()).solve(any(), any());
    }

    @Test
    void cancellationSkipsRemainingBatches() {
        MultiBatchOrchestrator orchestrator = orchestrator();
        doAnswer(inv -> {
            orchestrator.cancel();
            return serialize(inv.getArgument(0));
        }).when(solver).solve(any(), any());

        ScheduleResult result = orchestrator.run(jobs);

        assertEquals(Map.of(1L, 480L), startsById(result));
        assertEquals(List.of(UnscheduledJob.Reason.CANCELLED, UnscheduledJob.Reason.CANCELLED),
                result.getUnscheduledJobs().stream().map(UnscheduledJob::getReason).collect(Collectors.toList()));
        assertEquals(Map.of(1, BatchState.SOLVED, 2, BatchState.CANCELLED, 3, BatchState.CANCELLED),
                orchestrator.getBatchStates());
        assertTrue(orchestrator.isCancelled());
    }

    @Test
    void parallelSolvingKeepsTheSequentialTimeline() {
        parameters.setBatchParallelism(3);

        ScheduleResult result = orchestrator().run(jobs);

        assertEquals(Map.of(1L, 480L, 2L, 1920L, 3L, 3360L), startsById(result));
        assertEquals(List.of(1, 2, 3), result.getBatchReports().stream()
                .map(BatchReport::getBatchNumber).collect(Collectors.toList()));
    }

    @Test
    void duplicateJobIdsAreRejected() {
        assertThrows(SchedulingConfigurationException.class,
                () -> orchestrator().run(List.of(coreJob(1, "A", "PETG", 30), coreJob(1, "B", "PETG", 30))));
    }

    @Test
    void scheduledJobsNeverOverlapOnAPrinter() {
        List<PrintJob> many = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            many.add(coreJob(i, "Part " + (i % 4), "PETG", 50 + i * 10));
        }

        ScheduleResult result = orchestrator().run(many);

        List<ScheduledJob> scheduled = new ArrayList<>(result.getScheduledJobs());
        scheduled.sort((a, b) -> Long.compare(a.getStart(), b.getStart()));
        for (int i = 1; i < scheduled.size(); i++) {
            assertTrue(scheduled.get(i).getStart() >= scheduled.get(i - 1).getEnd());
        }
        assertEquals(many.size(), scheduled.size());
    }

    private MultiBatchOrchestrator orchestrator() {
        return new MultiBatchOrchestrator(roster, parameters, new GreedyTitleBatchPartitioner(), solver);
    }

    private static Map<Long, Long> startsById(ScheduleResult result) {
        return result.getScheduledJobs().stream()
                .collect(Collectors.toMap(s -> s.getJob().getId(), ScheduledJob::getStart));
    }

    /** 每个任务放在第一台兼容打印机上，从班次开始依次排开。 */
    static SolveOutcome serialize(BatchModel model) {
        Map<Long, Long> nextFree = new HashMap<>();
        List<SlotAssignment> assignments = new ArrayList<>();
        for (JobSlot slot : model.getSlots()) {
            Printer printer = slot.getCompatiblePrinters().get(0);
            long start = nextFree.getOrDefault(printer.getId(), (long) slot.getStartMin());
            long end = start + slot.getEffectiveDuration();
            nextFree.put(printer.getId(), end);
            assignments.add(new SlotAssignment(slot.getIndex(), printer.getId(), start, end));
        }
        return SolveOutcome.solved(SolveStatus.FEASIBLE, assignments, Duration.ZERO, "serial");
    }
}
