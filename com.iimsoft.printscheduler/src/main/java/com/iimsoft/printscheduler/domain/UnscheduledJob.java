package com.iimsoft.printscheduler.domain;

/**
 * 未能排入的任务及原因。batchNumber 为 null 表示未进入任何批次（例如无可用打印机）。
 */
public class UnscheduledJob {

    public enum Reason {
        /** 没有任何打印机同时满足材料/工艺/机型。 */
        UNROUTABLE,
        /** 所在批次无解或超时。 */
        BATCH_INFEASIBLE,
        /** 运行被取消，批次未求解。 */
        CANCELLED
    }

    private final PrintJob job;
    private final Reason reason;
    private final Integer batchNumber;

    public UnscheduledJob(PrintJob job, Reason reason, Integer batchNumber) {
        this.job = job;
        this.reason = reason;
        this.batchNumber = batchNumber;
    }

    public PrintJob getJob() { return job; }
    public Reason getReason() { return reason; }
    public Integer getBatchNumber() { return batchNumber; }

    @Override
    public String toString() {
        return "Job " + job.getId() + " unscheduled (" + reason + (batchNumber == null ? "" : ", batch " + batchNumber) + ")";
    }
}
