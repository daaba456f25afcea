package com.iimsoft.printscheduler.exception;

/**
 * 排程引擎所有异常的基类。
 */
public class SchedulingException extends RuntimeException {

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
