package com.iimsoft.printscheduler.service;

/**
 * 批次生命周期：PENDING → SOLVING → SOLVED | FAILED；取消时未开始的批次直接进入 CANCELLED。
 */
public enum BatchState {
    PENDING,
    SOLVING,
    SOLVED,
    FAILED,
    CANCELLED;

    public boolean isFinal() {
        return this == SOLVED || this == FAILED || this == CANCELLED;
    }
}
