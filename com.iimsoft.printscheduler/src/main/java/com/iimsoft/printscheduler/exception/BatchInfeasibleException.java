package com.iimsoft.printscheduler.exception;

/**
 * 批次无解：求解器证明不可行、时间耗尽、模型在结构上无解，或返回的解未通过校验。
 * 由编排器捕获，整批任务转入未排程列表。
 */
public class BatchInfeasibleException extends SchedulingException {

    private final int batchNumber;

    public BatchInfeasibleException(int batchNumber, String message) {
        super("Batch " + batchNumber + ": " + message);
        this.batchNumber = batchNumber;
    }

    public BatchInfeasibleException(int batchNumber, String message, Throwable cause) {
        super("Batch " + batchNumber + ": " + message, cause);
        this.batchNumber = batchNumber;
    }

    public int getBatchNumber() {
        return batchNumber;
    }
}
