package com.iimsoft.printscheduler.solver.optaplanner;

import java.util.List;

import org.optaplanner.core.api.domain.entity.PlanningEntity;
import org.optaplanner.core.api.domain.lookup.PlanningId;
import org.optaplanner.core.api.domain.valuerange.CountableValueRange;
import org.optaplanner.core.api.domain.valuerange.ValueRangeFactory;
import org.optaplanner.core.api.domain.valuerange.ValueRangeProvider;
import org.optaplanner.core.api.domain.variable.PlanningVariable;

import com.iimsoft.printscheduler.domain.Printer;
import com.iimsoft.printscheduler.model.JobSlot;

/**
 * 规划实体：一个任务的打印机和开工时间。
 *
 * 两个变量的值域都由实体自己提供：打印机只能从兼容列表里选，
 * 开工时间只能在 [startMin, startMax] 内选，因此兼容性和时间窗在结构上就得到保证。
 */
@PlanningEntity
public class JobAllocation {

    private Long id;

    private JobSlot slot;

    // Planning variables
    private Printer printer;
    private Integer start;

    public JobAllocation() {
    }

    public JobAllocation(JobSlot slot) {
        this.id = (long) slot.getIndex();
        this.slot = slot;
    }

    public JobAllocation(JobSlot slot, Printer printer, Integer start) {
        this(slot);
        this.printer = printer;
        this.start = start;
    }

    @PlanningId
    public Long getId() {
        return id;
    }

    public JobSlot getSlot() {
        return slot;
    }

    public int getSlotIndex() {
        return slot.getIndex();
    }

    @PlanningVariable(valueRangeProviderRefs = "printerRange")
    public Printer getPrinter() {
        return printer;
    }

    public void setPrinter(Printer printer) {
        this.printer = printer;
    }

    @PlanningVariable(valueRangeProviderRefs = "startRange")
    public Integer getStart() {
        return start;
    }

    public void setStart(Integer start) {
        this.start = start;
    }

    // ************************************************************************
    // Complex methods
    // ************************************************************************

    public boolean isAssigned() {
        return printer != null && start != null;
    }

    /** 含缓冲的结束时间，用于同机互斥。 */
    public Integer getEnd() {
        return start == null ? null : start + slot.getEffectiveDuration();
    }

    /** 真实完工时间 = start + 名义时长，不含缓冲。 */
    public Integer getTrueEnd() {
        return start == null ? null : start + slot.getNominalDuration();
    }

    public String getRack() {
        return printer == null ? null : printer.getRack().strip();
    }

    // ************************************************************************
    // Ranges
    // ************************************************************************

    @ValueRangeProvider(id = "printerRange")
    public List<Printer> getPrinterRange() {
        return slot.getCompatiblePrinters();
    }

    @ValueRangeProvider(id = "startRange")
    public CountableValueRange<Integer> getStartRange() {
        // to 为开区间
        return ValueRangeFactory.createIntValueRange(slot.getStartMin(), slot.getStartMax() + 1);
    }

    @Override
    public String toString() {
        return "Job " + slot.getJob().getId() + " -> " + (printer == null ? "?" : printer.getName()) + " @ " + start;
    }
}
