package com.iimsoft.printscheduler.batch;

import java.util.List;

import com.iimsoft.printscheduler.domain.JobBatch;
import com.iimsoft.printscheduler.domain.PrintJob;

/**
 * 把任务列表切分成求解器能处理的批次。
 *
 * 实现必须保证：每个任务恰好出现在一个批次中，批次非空，批次按求解顺序返回。
 */
public interface BatchPartitioner {

    List<JobBatch> partition(List<PrintJob> jobs, long capacityMinutes);
}
