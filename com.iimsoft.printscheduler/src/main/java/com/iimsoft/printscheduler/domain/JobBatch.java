package com.iimsoft.printscheduler.domain;

import java.util.List;

/**
 * 一个批次：作为一个约束模型一起求解的任务子集。编号从 1 开始。
 */
public class JobBatch {

    private final int number;
    private final List<PrintJob> jobs;

    public JobBatch(int number, List<PrintJob> jobs) {
        if (jobs == null || jobs.isEmpty()) {
            throw new IllegalArgumentException("Batch " + number + " must not be empty");
        }
        this.number = number;
        this.jobs = List.copyOf(jobs);
    }

    public int getNumber() { return number; }
    public List<PrintJob> getJobs() { return jobs; }

    public int size() {
        return jobs.size();
    }

    public long getTotalDurationMinutes() {
        return jobs.stream().mapToLong(PrintJob::getDurationMinutes).sum();
    }

    @Override
    public String toString() {
        return "Batch " + number + " (" + jobs.size() + " jobs, " + getTotalDurationMinutes() + " min)";
    }
}
