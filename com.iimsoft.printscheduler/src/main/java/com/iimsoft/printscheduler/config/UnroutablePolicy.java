package com.iimsoft.printscheduler.config;

/**
 * 遇到没有兼容打印机的任务时的处理方式。
 */
public enum UnroutablePolicy {
    /** 放入未排程列表，其余任务照常排程。 */
    REJECT,
    /** 作为配置错误，整次运行直接失败。 */
    FAIL
}
