package com.iimsoft.printscheduler.exception;

/**
 * 参数或打印机清单不合法。在任何批次开始之前抛出，整次运行失败。
 */
public class SchedulingConfigurationException extends SchedulingException {

    public SchedulingConfigurationException(String message) {
        super(message);
    }
}
