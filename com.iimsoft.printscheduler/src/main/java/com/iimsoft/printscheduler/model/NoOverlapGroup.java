package com.iimsoft.printscheduler.model;

import java.util.List;

import com.iimsoft.printscheduler.domain.Printer;

/**
 * 一台打印机上的互斥约束：slotIndexes 中的任务若被分配到该打印机（指示变量为真），
 * 其 [start, start + effectiveDuration) 区间两两不重叠。
 */
public class NoOverlapGroup {

    private final Printer printer;
    private final List<Integer> slotIndexes;

    public NoOverlapGroup(Printer printer, List<Integer> slotIndexes) {
        this.printer = printer;
        this.slotIndexes = List.copyOf(slotIndexes);
    }

    public Printer getPrinter() { return printer; }
    public List<Integer> getSlotIndexes() { return slotIndexes; }
}
