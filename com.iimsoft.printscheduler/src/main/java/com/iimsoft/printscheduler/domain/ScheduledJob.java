package com.iimsoft.printscheduler.domain;

/**
 * 排程结果中的一行：任务被分配到的打印机和时间（相对排程起点日 00:00 的分钟数）。
 *
 * end 含全局缓冲；trueEnd = start + 名义时长，不含缓冲。
 */
public class ScheduledJob {

    private final PrintJob job;
    private final Printer printer;
    private final int batchNumber;
    private final long start;
    private final long end;

    public ScheduledJob(PrintJob job, Printer printer, int batchNumber, long start, long end) {
        if (end - start < job.getDurationMinutes()) {
            throw new IllegalArgumentException("Job " + job.getId() + " scheduled for " + (end - start)
                    + " min, shorter than its duration " + job.getDurationMinutes());
        }
        this.job = job;
        this.printer = printer;
        this.batchNumber = batchNumber;
        this.start = start;
        this.end = end;
    }

    /** 平移到批次偏移量之后的新结果；原对象不变。 */
    public ScheduledJob shiftedBy(long offsetMinutes) {
        return new ScheduledJob(job, printer, batchNumber, start + offsetMinutes, end + offsetMinutes);
    }

    public PrintJob getJob() { return job; }
    public Printer getPrinter() { return printer; }
    public int getBatchNumber() { return batchNumber; }
    public long getStart() { return start; }
    public long getEnd() { return end; }

    public long getTrueEnd() {
        return start + job.getDurationMinutes();
    }

    public String getRack() {
        return printer.getRack();
    }

    @Override
    public String toString() {
        return "Job " + job.getId() + " on " + printer.getName() + " [" + start + ", " + end + ") batch " + batchNumber;
    }
}
