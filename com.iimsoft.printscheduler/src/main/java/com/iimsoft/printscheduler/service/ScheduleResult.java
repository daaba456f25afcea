package com.iimsoft.printscheduler.service;

import java.util.List;

import com.iimsoft.printscheduler.domain.ScheduledJob;
import com.iimsoft.printscheduler.domain.UnscheduledJob;

/**
 * 一次排程运行的完整输出：已排任务（批次顺序，批内按任务顺序）、未排任务和每个批次的报告。
 */
public class ScheduleResult {

    private final List<ScheduledJob> scheduledJobs;
    private final List<UnscheduledJob> unscheduledJobs;
    private final List<BatchReport> batchReports;

    public ScheduleResult(List<ScheduledJob> scheduledJobs, List<UnscheduledJob> unscheduledJobs,
                          List<BatchReport> batchReports) {
        this.scheduledJobs = List.copyOf(scheduledJobs);
        this.unscheduledJobs = List.copyOf(unscheduledJobs);
        this.batchReports = List.copyOf(batchReports);
    }

    public List<ScheduledJob> getScheduledJobs() { return scheduledJobs; }
    public List<UnscheduledJob> getUnscheduledJobs() { return unscheduledJobs; }
    public List<BatchReport> getBatchReports() { return batchReports; }

    /** 所有已排任务中最晚的真实完工时间，没有已排任务时为 0。 */
    public long getMakespan() {
        return scheduledJobs.stream().mapToLong(ScheduledJob::getTrueEnd).max().orElse(0L);
    }

    public boolean isComplete() {
        return unscheduledJobs.isEmpty();
    }
}
