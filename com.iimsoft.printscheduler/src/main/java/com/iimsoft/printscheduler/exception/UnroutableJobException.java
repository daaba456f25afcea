package com.iimsoft.printscheduler.exception;

import java.util.List;

import com.iimsoft.printscheduler.domain.PrintJob;

/**
 * 任务没有任何兼容的打印机，无法建模。
 */
public class UnroutableJobException extends SchedulingException {

    private final List<PrintJob> jobs;

    public UnroutableJobException(List<PrintJob> jobs) {
        super("No compatible printer for " + jobs.size() + " job(s): " + jobs);
        this.jobs = List.copyOf(jobs);
    }

    public List<PrintJob> getJobs() {
        return jobs;
    }
}
