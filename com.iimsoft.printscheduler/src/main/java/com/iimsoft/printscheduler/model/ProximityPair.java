package com.iimsoft.printscheduler.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 一对需要比较完工时间的同工艺任务（按 slot 编号）。
 * 两者真实完工时间相差不超过 thresholdMinutes 且机架不同，记 1 分惩罚。
 */
@Data
@AllArgsConstructor
public class ProximityPair {

    private int leftSlot;
    private int rightSlot;
    private int thresholdMinutes;

    public boolean penalizes(long leftTrueEnd, long rightTrueEnd, boolean sameRack) {
        return !sameRack && Math.abs(leftTrueEnd - rightTrueEnd) <= thresholdMinutes;
    }
}
