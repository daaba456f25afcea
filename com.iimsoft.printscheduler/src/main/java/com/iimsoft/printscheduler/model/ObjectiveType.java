package com.iimsoft.printscheduler.model;

public enum ObjectiveType {
    /**
     * makespan + 邻近完工惩罚 + 负载均衡 + 开工时间和（轻权重）。
     */
    OPERATOR_AWARE_COMPOSITE,
    /**
     * makespan × (打印机数 + 1) + 使用的打印机数 + 开工时间和。
     */
    MAKESPAN_AND_PRINTERS
}
