package com.iimsoft.printscheduler.model;

import java.util.List;

import com.iimsoft.printscheduler.domain.PrintJob;
import com.iimsoft.printscheduler.domain.Printer;

/**
 * 模型中一个任务的决策变量声明：
 * <ul>
 *     <li>start ∈ [startMin, startMax]，startMax = horizon - effectiveDuration</li>
 *     <li>end = start + effectiveDuration</li>
 *     <li>printer ∈ compatiblePrinters（不兼容的打印机根本不在值域里）</li>
 *     <li>每个 (任务, 兼容打印机) 一个指示变量，指示为真当且仅当 printer 等于该打印机</li>
 *     <li>rack = 所选打印机的机架</li>
 * </ul>
 */
public class JobSlot {

    private final int index;
    private final PrintJob job;
    private final int effectiveDuration;
    private final int startMin;
    private final int startMax;
    private final List<Printer> compatiblePrinters;

    public JobSlot(int index, PrintJob job, int effectiveDuration, int startMin, int startMax,
                   List<Printer> compatiblePrinters) {
        this.index = index;
        this.job = job;
        this.effectiveDuration = effectiveDuration;
        this.startMin = startMin;
        this.startMax = startMax;
        this.compatiblePrinters = List.copyOf(compatiblePrinters);
    }

    /** start 值域非空。 */
    public boolean hasStartDomain() {
        return startMax >= startMin;
    }

    public boolean canUse(Printer printer) {
        return compatiblePrinters.contains(printer);
    }

    public long[] getPrinterIdDomain() {
        return compatiblePrinters.stream().mapToLong(Printer::getId).toArray();
    }

    public int getIndex() { return index; }
    public PrintJob getJob() { return job; }
    public int getNominalDuration() { return job.getDurationMinutes(); }
    public int getEffectiveDuration() { return effectiveDuration; }
    public int getStartMin() { return startMin; }
    public int getStartMax() { return startMax; }
    public List<Printer> getCompatiblePrinters() { return compatiblePrinters; }

    @Override
    public String toString() {
        return "slot " + index + " (job " + job.getId() + ", start " + startMin + ".." + startMax
                + ", " + compatiblePrinters.size() + " printers)";
    }
}
