package com.iimsoft.printscheduler.model;

import java.util.List;

import com.iimsoft.printscheduler.domain.MaterialTechnology;

import lombok.Data;

/**
 * 单个批次的时间窗估算结果。horizon 为分钟，是该批次所有开始/结束变量的上界。
 */
@Data
public class HorizonEstimate {

    private final int horizon;
    private final long days;
    /** 最忙的 (材料, 工艺) 组合预计需要的天数。 */
    private final double daysNeeded;
    private final MaterialTechnology busiestPairing;
    /** 批次中出现、但没有任何打印机支持的组合。 */
    private final List<MaterialTechnology> unsupportedPairings;
    private final boolean degenerate;
}
