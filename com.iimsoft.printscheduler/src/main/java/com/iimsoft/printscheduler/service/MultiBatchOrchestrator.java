package com.iimsoft.printscheduler.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.iimsoft.printscheduler.batch.BatchPartitioner;
import com.iimsoft.printscheduler.config.SchedulingParameters;
import com.iimsoft.printscheduler.config.UnroutablePolicy;
import com.iimsoft.printscheduler.domain.JobBatch;
import com.iimsoft.printscheduler.domain.PrintJob;
import com.iimsoft.printscheduler.domain.PrinterRoster;
import com.iimsoft.printscheduler.domain.ScheduledJob;
import com.iimsoft.printscheduler.domain.UnscheduledJob;
import com.iimsoft.printscheduler.exception.BatchInfeasibleException;
import com.iimsoft.printscheduler.exception.SchedulingConfigurationException;
import com.iimsoft.printscheduler.exception.SchedulingException;
import com.iimsoft.printscheduler.exception.UnroutableJobException;
import com.iimsoft.printscheduler.model.BatchModel;
import com.iimsoft.printscheduler.model.ConstraintModelBuilder;
import com.iimsoft.printscheduler.model.HorizonEstimate;
import com.iimsoft.printscheduler.model.HorizonEstimator;
import com.iimsoft.printscheduler.model.ObjectiveComposer;
import com.iimsoft.printscheduler.solver.BatchSolution;
import com.iimsoft.printscheduler.solver.BatchSolveDriver;
import com.iimsoft.printscheduler.solver.ConstraintSolver;

/**
 * 多批次编排：路由检查 → 分批 → 逐批求解 → 按时间偏移合并。
 *
 * 偏移量从 0 开始，每个成功批次之后增加 batchOffsetShifts 个班次；失败的批次不占用时间轴，
 * 其任务全部进入未排程列表，不影响后续批次。
 * 一个实例对应一次运行，{@link #cancel()} 之后尚未开始的批次都标记为 CANCELLED。
 */
public class MultiBatchOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(MultiBatchOrchestrator.class);

    private final PrinterRoster roster;
    private final SchedulingParameters parameters;
    private final BatchPartitioner partitioner;
    private final HorizonEstimator horizonEstimator;
    private final ConstraintModelBuilder modelBuilder;
    private final BatchSolveDriver solveDriver;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Map<Integer, BatchState> batchStates = new ConcurrentHashMap<>();

    public MultiBatchOrchestrator(PrinterRoster roster, SchedulingParameters parameters,
                                  BatchPartitioner partitioner, ConstraintSolver solver) {
        this.roster = roster;
        this.parameters = parameters;
        this.partitioner = partitioner;
        this.horizonEstimator = new HorizonEstimator(roster, parameters);
        this.modelBuilder = new ConstraintModelBuilder(roster, parameters, new ObjectiveComposer(parameters));
        this.solveDriver = new BatchSolveDriver(solver, parameters.getSolveTimeLimit());
    }

    public ScheduleResult run(List<PrintJob> jobs) {
        checkUniqueIds(jobs);

        List<UnscheduledJob> unscheduled = new ArrayList<>();
        List<PrintJob> routable = new ArrayList<>();
        List<PrintJob> unroutable = new ArrayList<>();
        for (PrintJob job : jobs) {
            if (roster.isRoutable(job)) {
                routable.add(job);
            } else {
                unroutable.add(job);
            }
        }
        if (!unroutable.isEmpty()) {
            if (parameters.getUnroutablePolicy() == UnroutablePolicy.FAIL) {
                throw new UnroutableJobException(unroutable);
            }
            for (PrintJob job : unroutable) {
                LOGGER.warn("No compatible printer for job {} ({} {} {}), leaving it unscheduled",
                        job.getId(), job.getTechnology(), job.getMaterial(), job.getMachineModel());
                unscheduled.add(new UnscheduledJob(job, UnscheduledJob.Reason.UNROUTABLE, null));
            }
        }

        List<JobBatch> batches = routable.isEmpty()
                ? List.of()
                : partitioner.partition(routable, batchCapacityMinutes());
        LOGGER.info("Scheduling {} jobs in {} batches on {} printers ({} unroutable)",
                jobs.size(), batches.size(), roster.size(), unroutable.size());
        for (JobBatch batch : batches) {
            batchStates.put(batch.getNumber(), BatchState.PENDING);
        }

        Map<Integer, BatchAttempt> attempts = parameters.getBatchParallelism() > 1 && batches.size() > 1
                ? solveInParallel(batches)
                : new LinkedHashMap<>();

        List<ScheduledJob> scheduled = new ArrayList<>();
        List<BatchReport> reports = new ArrayList<>();
        long offset = 0L;
        for (JobBatch batch : batches) {
            BatchAttempt attempt = attempts.containsKey(batch.getNumber())
                    ? attempts.get(batch.getNumber())
                    : attempt(batch);

            if (attempt.cancelled) {
                batchStates.put(batch.getNumber(), BatchState.CANCELLED);
                addUnscheduled(unscheduled, batch, UnscheduledJob.Reason.CANCELLED);
                reports.add(new BatchReport(batch.getNumber(), BatchState.CANCELLED, batch.size(), null, null,
                        null, null, null, "run cancelled"));
                continue;
            }
            if (attempt.failure != null) {
                batchStates.put(batch.getNumber(), BatchState.FAILED);
                LOGGER.warn("Batch {} failed, {} jobs left unscheduled: {}", batch.getNumber(), batch.size(),
                        attempt.failure.getMessage());
                addUnscheduled(unscheduled, batch, UnscheduledJob.Reason.BATCH_INFEASIBLE);
                reports.add(new BatchReport(batch.getNumber(), BatchState.FAILED, batch.size(),
                        attempt.horizon, null, null, null, null, attempt.failure.getMessage()));
                continue;
            }

            BatchSolution solution = attempt.solution;
            for (ScheduledJob job : solution.getScheduledJobs()) {
                scheduled.add(job.shiftedBy(offset));
            }
            batchStates.put(batch.getNumber(), BatchState.SOLVED);
            reports.add(new BatchReport(batch.getNumber(), BatchState.SOLVED, batch.size(),
                    solution.getModel().getHorizon(), offset, solution.getOutcome().getStatus(),
                    solution.getObjective(), solution.getOutcome().getWallTime(), null));
            LOGGER.info("Batch {} solved: {} jobs, offset {} min, proximity penalty {}", batch.getNumber(),
                    batch.size(), offset, solution.getProximityPenalty());
            offset += parameters.getBatchOffsetMinutes();
        }

        LOGGER.info("Scheduled {} of {} jobs, {} unscheduled", scheduled.size(), jobs.size(), unscheduled.size());
        return new ScheduleResult(scheduled, unscheduled, reports);
    }

    /**
     * 请求取消：正在求解的批次照常完成，尚未开始的批次不再求解。
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOGGER.info("Cancellation requested");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** 各批次当前状态的快照。 */
    public Map<Integer, BatchState> getBatchStates() {
        return Map.copyOf(batchStates);
    }

    long batchCapacityMinutes() {
        return (long) parameters.getShiftLengthMinutes() * Math.max(1, roster.size());
    }

    private BatchAttempt attempt(JobBatch batch) {
        if (cancelled.get()) {
            return BatchAttempt.cancelled();
        }
        batchStates.put(batch.getNumber(), BatchState.SOLVING);
        LOGGER.info("Solving {}", batch);
        Integer horizon = null;
        try {
            HorizonEstimate estimate = horizonEstimator.estimate(batch.getJobs());
            horizon = estimate.getHorizon();
            BatchModel model = modelBuilder.build(batch, estimate);
            return BatchAttempt.solved(solveDriver.solve(model));
        } catch (BatchInfeasibleException e) {
            return BatchAttempt.failed(e, horizon);
        } catch (SchedulingException | IllegalStateException e) {
            return BatchAttempt.failed(new BatchInfeasibleException(batch.getNumber(), e.getMessage(), e), horizon);
        }
    }

    private Map<Integer, BatchAttempt> solveInParallel(List<JobBatch> batches) {
        int threads = Math.min(parameters.getBatchParallelism(), batches.size());
        LOGGER.info("Solving {} batches on {} threads", batches.size(), threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            Map<Integer, Future<BatchAttempt>> futures = new LinkedHashMap<>();
            for (JobBatch batch : batches) {
                futures.put(batch.getNumber(), executor.submit(() -> attempt(batch)));
            }
            Map<Integer, BatchAttempt> attempts = new LinkedHashMap<>();
            for (Map.Entry<Integer, Future<BatchAttempt>> e : futures.entrySet()) {
                try {
                    attempts.put(e.getKey(), e.getValue().get());
                } catch (ExecutionException ex) {
                    attempts.put(e.getKey(), BatchAttempt.failed(
                            new BatchInfeasibleException(e.getKey(), "solve task failed", ex.getCause()), null));
                }
            }
            return attempts;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchedulingException("Interrupted while waiting for batch results", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void addUnscheduled(List<UnscheduledJob> unscheduled, JobBatch batch, UnscheduledJob.Reason reason) {
        for (PrintJob job : batch.getJobs()) {
            unscheduled.add(new UnscheduledJob(job, reason, batch.getNumber()));
        }
    }

    private static void checkUniqueIds(List<PrintJob> jobs) {
        Set<Long> ids = new HashSet<>();
        for (PrintJob job : jobs) {
            if (!ids.add(job.getId())) {
                throw new SchedulingConfigurationException("Duplicate job id: " + job.getId());
            }
        }
    }

    private static final class BatchAttempt {

        private final BatchSolution solution;
        private final BatchInfeasibleException failure;
        private final Integer horizon;
        private final boolean cancelled;

        private BatchAttempt(BatchSolution solution, BatchInfeasibleException failure, Integer horizon,
                             boolean cancelled) {
            this.solution = solution;
            this.failure = failure;
            this.horizon = horizon;
            this.cancelled = cancelled;
        }

        static BatchAttempt solved(BatchSolution solution) {
            return new BatchAttempt(solution, null, solution.getModel().getHorizon(), false);
        }

        static BatchAttempt failed(BatchInfeasibleException failure, Integer horizon) {
            return new BatchAttempt(null, failure, horizon, false);
        }

        static BatchAttempt cancelled() {
            return new BatchAttempt(null, null, null, true);
        }
    }
}
