package com.iimsoft.printscheduler.service;

import java.time.Duration;

import com.iimsoft.printscheduler.model.ObjectiveBreakdown;
import com.iimsoft.printscheduler.solver.SolveStatus;

/**
 * 单个批次的处理结果摘要。未求解的批次 solveStatus / objective / wallTime 为 null。
 */
public class BatchReport {

    private final int batchNumber;
    private final BatchState state;
    private final int jobCount;
    private final Integer horizon;
    private final Long offsetMinutes;
    private final SolveStatus solveStatus;
    private final ObjectiveBreakdown objective;
    private final Duration wallTime;
    private final String message;

    public BatchReport(int batchNumber, BatchState state, int jobCount, Integer horizon, Long offsetMinutes,
                       SolveStatus solveStatus, ObjectiveBreakdown objective, Duration wallTime, String message) {
        this.batchNumber = batchNumber;
        this.state = state;
        this.jobCount = jobCount;
        this.horizon = horizon;
        this.offsetMinutes = offsetMinutes;
        this.solveStatus = solveStatus;
        this.objective = objective;
        this.wallTime = wallTime;
        this.message = message;
    }

    public int getBatchNumber() { return batchNumber; }
    public BatchState getState() { return state; }
    public int getJobCount() { return jobCount; }
    public Integer getHorizon() { return horizon; }
    public Long getOffsetMinutes() { return offsetMinutes; }
    public SolveStatus getSolveStatus() { return solveStatus; }
    public ObjectiveBreakdown getObjective() { return objective; }
    public Duration getWallTime() { return wallTime; }
    public String getMessage() { return message; }

    /** 实际的邻近完工惩罚；未求解时为 null。 */
    public Long getProximityPenalty() {
        return objective == null ? null : objective.getProximityPenalty();
    }

    @Override
    public String toString() {
        return "Batch " + batchNumber + " " + state + " (" + jobCount + " jobs"
                + (offsetMinutes == null ? "" : ", offset " + offsetMinutes)
                + (solveStatus == null ? "" : ", " + solveStatus)
                + (message == null ? "" : ", " + message) + ")";
    }
}
