package com.iimsoft.printscheduler.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 目标函数各项权重。目标 = Σ 权重 × 对应项，越小越好。
 */
@Data
@AllArgsConstructor
public class ObjectiveWeights {

    private long makespanWeight;
    private long proximityWeight;
    private long loadBalanceWeight;
    private long tieBreakWeight;
    private long printerUsageWeight;

    public boolean usesProximity() {
        return proximityWeight > 0;
    }

    public boolean usesLoadBalance() {
        return loadBalanceWeight > 0;
    }

    public boolean usesPrinterUsage() {
        return printerUsageWeight > 0;
    }
}
