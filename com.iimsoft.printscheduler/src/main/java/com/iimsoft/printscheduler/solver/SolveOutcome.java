package com.iimsoft.printscheduler.solver;

import java.time.Duration;
import java.util.List;

import com.iimsoft.printscheduler.model.SlotAssignment;

/**
 * 求解结果：要么是每个 slot 都有取值的完整解，要么是“无解”信号，不存在部分解。
 */
public class SolveOutcome {

    private final SolveStatus status;
    private final List<SlotAssignment> assignments;
    private final Duration wallTime;
    private final String detail;

    private SolveOutcome(SolveStatus status, List<SlotAssignment> assignments, Duration wallTime, String detail) {
        this.status = status;
        this.assignments = assignments;
        this.wallTime = wallTime;
        this.detail = detail;
    }

    public static SolveOutcome solved(SolveStatus status, List<SlotAssignment> assignments, Duration wallTime,
                                      String detail) {
        if (!status.hasSolution()) {
            throw new IllegalArgumentException("Status " + status + " carries no solution");
        }
        return new SolveOutcome(status, List.copyOf(assignments), wallTime, detail);
    }

    public static SolveOutcome noSolution(SolveStatus status, Duration wallTime, String detail) {
        if (status.hasSolution()) {
            throw new IllegalArgumentException("Status " + status + " requires a solution");
        }
        return new SolveOutcome(status, List.of(), wallTime, detail);
    }

    public SolveStatus getStatus() { return status; }
    public List<SlotAssignment> getAssignments() { return assignments; }
    public Duration getWallTime() { return wallTime; }
    public String getDetail() { return detail; }

    @Override
    public String toString() {
        return status + " in " + wallTime.toMillis() + " ms" + (detail == null ? "" : " (" + detail + ")");
    }
}
