package com.iimsoft.printscheduler.api.dto;

import java.util.List;

public class ScheduleResponse {

    /** 分钟偏移的起点日，分钟 0 = 该日 00:00 */
    public String scheduleStartDate; // YYYY-MM-DD

    public long makespanMinutes;

    public List<ScheduledJobResult> scheduled;
    public List<UnscheduledJobResult> unscheduled;
    public List<BatchResult> batches;

    public static class ScheduledJobResult {
        public long jobId;
        public String title;
        public long printerId;
        public String printerName;
        public String rack;
        public int batchNumber;

        public long startMinute;
        public long endMinute;
        public long trueEndMinute;

        public String startDateTime; // ISO-8601
        public String endDateTime;

        public String material;
        public String technology;
        public String machineModel;
        public int durationMinutes;
        public int alphaQuantityOnPlate;
    }

    public static class UnscheduledJobResult {
        public long jobId;
        public String title;
        public String reason; // UNROUTABLE/BATCH_INFEASIBLE/CANCELLED
        public Integer batchNumber;

        public String material;
        public String technology;
        public String machineModel;
        public int durationMinutes;
        public int alphaQuantityOnPlate;
    }

    public static class BatchResult {
        public int batchNumber;
        public String state;
        public int jobCount;
        public Integer horizonMinutes;
        public Long offsetMinutes;
        public String solveStatus;
        public Long makespan;
        public Long proximityPenalty;
        public Long maxJobsPerPrinter;
        public Long printersUsed;
        public Long objective;
        public Long wallTimeMillis;
        public String message;
    }
}
