package com.iimsoft.printscheduler.domain;

import java.util.Objects;

/**
 * 一个打印任务（一次上板打印）。
 *
 * 由上游的 BOM/生产计划导入生成，排程引擎只读不改。
 * 时长为名义打印时长（分钟），不含排程用的全局缓冲时间。
 */
public class PrintJob {

    private final long id;
    private final String title;
    private final String material;
    private final String technology;
    private final String machineModel;
    private final int durationMinutes;
    private final int alphaQuantityOnPlate;

    public PrintJob(long id, String title, String material, String technology, String machineModel,
                    int durationMinutes) {
        this(id, title, material, technology, machineModel, durationMinutes, 1);
    }

    public PrintJob(long id, String title, String material, String technology, String machineModel,
                    int durationMinutes, int alphaQuantityOnPlate) {
        if (durationMinutes <= 0) {
            throw new IllegalArgumentException("Job " + id + " must have a positive duration, got " + durationMinutes);
        }
        if (alphaQuantityOnPlate <= 0) {
            throw new IllegalArgumentException("Job " + id + " must have a positive plate quantity, got "
                    + alphaQuantityOnPlate);
        }
        this.id = id;
        this.title = Objects.requireNonNull(title, "title");
        this.material = Objects.requireNonNull(material, "material");
        this.technology = Objects.requireNonNull(technology, "technology");
        this.machineModel = Objects.requireNonNull(machineModel, "machineModel");
        this.durationMinutes = durationMinutes;
        this.alphaQuantityOnPlate = alphaQuantityOnPlate;
    }

    public long getId() { return id; }
    public String getTitle() { return title; }
    public String getMaterial() { return material; }
    public String getTechnology() { return technology; }
    public String getMachineModel() { return machineModel; }
    public int getDurationMinutes() { return durationMinutes; }
    public int getAlphaQuantityOnPlate() { return alphaQuantityOnPlate; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrintJob)) return false;
        return id == ((PrintJob) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "PrintJob{" + id + " '" + title + "' " + technology + "/" + material + "/" + machineModel
                + ", " + durationMinutes + "min}";
    }
}
