package com.iimsoft.printscheduler.model;

import lombok.Data;

/**
 * 求解器给某个 slot 的具体取值。end 含全局缓冲。
 */
@Data
public class SlotAssignment {

    private final int slotIndex;
    private final long printerId;
    private final long start;
    private final long end;
}
