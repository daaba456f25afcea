package com.iimsoft.printscheduler.config;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.iimsoft.printscheduler.exception.SchedulingConfigurationException;
import com.iimsoft.printscheduler.model.ObjectiveType;

/**
 * 排程参数，全部由调用方提供，字段初始值即默认值。
 * 可直接由 Jackson 从请求 JSON 绑定，未知字段忽略。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchedulingParameters {

    @JsonProperty("shiftStartHour")
    private int shiftStartHour = 8;

    @JsonProperty("shiftLengthHours")
    private int shiftLengthHours = 12;

    /** 同工艺任务完工时间差在该分钟数以内视为“太近”。 */
    @JsonProperty("proximityThresholdMinutes")
    private int proximityThresholdMinutes = 30;

    @JsonProperty("proximityPenaltyWeight")
    private long proximityPenaltyWeight = 5;

    /** 每个任务在排程时追加的固定缓冲（分钟），不计入真实完工时间。 */
    @JsonProperty("jobBufferMinutes")
    private int jobBufferMinutes = 0;

    @JsonProperty("solveTimeLimitSeconds")
    private long solveTimeLimitSeconds = 100;

    @JsonProperty("horizonSafetyFactor")
    private double horizonSafetyFactor = 3.0;

    @JsonProperty("horizonPadDays")
    private int horizonPadDays = 2;

    @JsonProperty("makespanWeight")
    private long makespanWeight = 1;

    @JsonProperty("loadBalanceWeight")
    private long loadBalanceWeight = 30;

    @JsonProperty("tieBreakWeight")
    private long tieBreakWeight = 1;

    /** 按时长排序后每个任务最多与后面多少个任务比较（含自身的窗口大小）。 */
    @JsonProperty("proximityLookahead")
    private int proximityLookahead = 20;

    /** 时长差超过该值即停止向后比较。 */
    @JsonProperty("proximityDurationGapMinutes")
    private int proximityDurationGapMinutes = 60;

    /** 每个成功批次之后时间轴前移多少个班次。 */
    @JsonProperty("batchOffsetShifts")
    private int batchOffsetShifts = 2;

    @JsonProperty("objectiveType")
    private ObjectiveType objectiveType = ObjectiveType.OPERATOR_AWARE_COMPOSITE;

    @JsonProperty("solverEngine")
    private SolverEngine solverEngine = SolverEngine.OPTAPLANNER;

    @JsonProperty("unroutablePolicy")
    private UnroutablePolicy unroutablePolicy = UnroutablePolicy.REJECT;

    @JsonProperty("batchParallelism")
    private int batchParallelism = 1;

    /** CP-SAT 搜索线程数，只对 CP_SAT 引擎生效。 */
    @JsonProperty("cpSatWorkers")
    private int cpSatWorkers = 8;

    /** 排程起点日（YYYY-MM-DD），所有分钟偏移都相对该日 00:00；为空时取当天。 */
    @JsonProperty("scheduleStartDate")
    private String scheduleStartDate;

    public SchedulingParameters() {
    }

    /**
     * 在处理任何批次之前校验全部参数，不合法直接抛出。
     */
    public SchedulingParameters validate() {
        require(shiftStartHour >= 0 && shiftStartHour <= 23, "shiftStartHour must be within 0..23, got " + shiftStartHour);
        require(shiftLengthHours >= 1 && shiftLengthHours <= 24, "shiftLengthHours must be within 1..24, got " + shiftLengthHours);
        require(proximityThresholdMinutes >= 0, "proximityThresholdMinutes must be >= 0, got " + proximityThresholdMinutes);
        require(proximityPenaltyWeight >= 0, "proximityPenaltyWeight must be >= 0, got " + proximityPenaltyWeight);
        require(jobBufferMinutes >= 0, "jobBufferMinutes must be >= 0, got " + jobBufferMinutes);
        require(solveTimeLimitSeconds > 0, "solveTimeLimitSeconds must be > 0, got " + solveTimeLimitSeconds);
        require(horizonSafetyFactor >= 1.0 && !Double.isNaN(horizonSafetyFactor) && !Double.isInfinite(horizonSafetyFactor),
                "horizonSafetyFactor must be a finite value >= 1.0, got " + horizonSafetyFactor);
        require(horizonPadDays >= 0, "horizonPadDays must be >= 0, got " + horizonPadDays);
        require(makespanWeight >= 0, "makespanWeight must be >= 0, got " + makespanWeight);
        require(loadBalanceWeight >= 0, "loadBalanceWeight must be >= 0, got " + loadBalanceWeight);
        require(tieBreakWeight >= 0, "tieBreakWeight must be >= 0, got " + tieBreakWeight);
        require(proximityLookahead >= 1, "proximityLookahead must be >= 1, got " + proximityLookahead);
        require(proximityDurationGapMinutes >= 0, "proximityDurationGapMinutes must be >= 0, got " + proximityDurationGapMinutes);
        require(batchOffsetShifts >= 0, "batchOffsetShifts must be >= 0, got " + batchOffsetShifts);
        require(batchParallelism >= 1, "batchParallelism must be >= 1, got " + batchParallelism);
        require(cpSatWorkers >= 1, "cpSatWorkers must be >= 1, got " + cpSatWorkers);
        require(objectiveType != null, "objectiveType must not be null");
        require(solverEngine != null, "solverEngine must not be null");
        require(unroutablePolicy != null, "unroutablePolicy must not be null");
        if (scheduleStartDate != null && !scheduleStartDate.isBlank()) {
            try {
                LocalDate.parse(scheduleStartDate.trim());
            } catch (DateTimeParseException e) {
                throw new SchedulingConfigurationException("scheduleStartDate must be YYYY-MM-DD, got '" + scheduleStartDate + "'");
            }
        }
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new SchedulingConfigurationException(message);
        }
    }

    // ************************************************************************
    // Derived values
    // ************************************************************************

    @JsonIgnore
    public int getShiftStartMinutes() {
        return shiftStartHour * 60;
    }

    @JsonIgnore
    public int getShiftLengthMinutes() {
        return shiftLengthHours * 60;
    }

    @JsonIgnore
    public Duration getSolveTimeLimit() {
        return Duration.ofSeconds(solveTimeLimitSeconds);
    }

    @JsonIgnore
    public long getBatchOffsetMinutes() {
        return (long) batchOffsetShifts * getShiftLengthMinutes();
    }

    @JsonIgnore
    public LocalDate getScheduleEpoch() {
        if (scheduleStartDate == null || scheduleStartDate.isBlank()) {
            return LocalDate.now();
        }
        return LocalDate.parse(scheduleStartDate.trim());
    }

    // ************************************************************************
    // Getters and setters
    // ************************************************************************

    public int getShiftStartHour() { return shiftStartHour; }
    public void setShiftStartHour(int shiftStartHour) { this.shiftStartHour = shiftStartHour; }
    public int getShiftLengthHours() { return shiftLengthHours; }
    public void setShiftLengthHours(int shiftLengthHours) { this.shiftLengthHours = shiftLengthHours; }
    public int getProximityThresholdMinutes() { return proximityThresholdMinutes; }
    public void setProximityThresholdMinutes(int proximityThresholdMinutes) { this.proximityThresholdMinutes = proximityThresholdMinutes; }
    public long getProximityPenaltyWeight() { return proximityPenaltyWeight; }
    public void setProximityPenaltyWeight(long proximityPenaltyWeight) { this.proximityPenaltyWeight = proximityPenaltyWeight; }
    public int getJobBufferMinutes() { return jobBufferMinutes; }
    public void setJobBufferMinutes(int jobBufferMinutes) { this.jobBufferMinutes = jobBufferMinutes; }
    public long getSolveTimeLimitSeconds() { return solveTimeLimitSeconds; }
    public void setSolveTimeLimitSeconds(long solveTimeLimitSeconds) { this.solveTimeLimitSeconds = solveTimeLimitSeconds; }
    public double getHorizonSafetyFactor() { return horizonSafetyFactor; }
    public void setHorizonSafetyFactor(double horizonSafetyFactor) { this.horizonSafetyFactor = horizonSafetyFactor; }
    public int getHorizonPadDays() { return horizonPadDays; }
    public void setHorizonPadDays(int horizonPadDays) { this.horizonPadDays = horizonPadDays; }
    public long getMakespanWeight() { return makespanWeight; }
    public void setMakespanWeight(long makespanWeight) { this.makespanWeight = makespanWeight; }
    public long getLoadBalanceWeight() { return loadBalanceWeight; }
    public void setLoadBalanceWeight(long loadBalanceWeight) { this.loadBalanceWeight = loadBalanceWeight; }
    public long getTieBreakWeight() { return tieBreakWeight; }
    public void setTieBreakWeight(long tieBreakWeight) { this.tieBreakWeight = tieBreakWeight; }
    public int getProximityLookahead() { return proximityLookahead; }
    public void setProximityLookahead(int proximityLookahead) { this.proximityLookahead = proximityLookahead; }
    public int getProximityDurationGapMinutes() { return proximityDurationGapMinutes; }
    public void setProximityDurationGapMinutes(int proximityDurationGapMinutes) { this.proximityDurationGapMinutes = proximityDurationGapMinutes; }
    public int getBatchOffsetShifts() { return batchOffsetShifts; }
    public void setBatchOffsetShifts(int batchOffsetShifts) { this.batchOffsetShifts = batchOffsetShifts; }
    public ObjectiveType getObjectiveType() { return objectiveType; }
    public void setObjectiveType(ObjectiveType objectiveType) { this.objectiveType = objectiveType; }
    public SolverEngine getSolverEngine() { return solverEngine; }
    public void setSolverEngine(SolverEngine solverEngine) { this.solverEngine = solverEngine; }
    public UnroutablePolicy getUnroutablePolicy() { return unroutablePolicy; }
    public void setUnroutablePolicy(UnroutablePolicy unroutablePolicy) { this.unroutablePolicy = unroutablePolicy; }
    public int getBatchParallelism() { return batchParallelism; }
    public void setBatchParallelism(int batchParallelism) { this.batchParallelism = batchParallelism; }
    public int getCpSatWorkers() { return cpSatWorkers; }
    public void setCpSatWorkers(int cpSatWorkers) { this.cpSatWorkers = cpSatWorkers; }
    public String getScheduleStartDate() { return scheduleStartDate; }
    public void setScheduleStartDate(String scheduleStartDate) { this.scheduleStartDate = scheduleStartDate; }
}
