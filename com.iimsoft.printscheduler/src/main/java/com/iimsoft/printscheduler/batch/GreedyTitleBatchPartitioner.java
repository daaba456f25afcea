package com.iimsoft.printscheduler.batch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.iimsoft.printscheduler.domain.JobBatch;
import com.iimsoft.printscheduler.domain.PrintJob;
import com.iimsoft.printscheduler.exception.SchedulingConfigurationException;

/**
 * 按标题稳定排序后顺序装箱：累计时长不超过容量就放进当前批次，否则另起一批。
 * 不是最优装箱，只追求结果可复现。单个任务超过容量时自成一批。
 */
public class GreedyTitleBatchPartitioner implements BatchPartitioner {

    private static final Logger LOGGER = LoggerFactory.getLogger(GreedyTitleBatchPartitioner.class);

    @Override
    public List<JobBatch> partition(List<PrintJob> jobs, long capacityMinutes) {
        if (capacityMinutes <= 0) {
            throw new SchedulingConfigurationException("Batch capacity must be positive, got " + capacityMinutes);
        }
        // List.sort 是稳定排序，同标题保持输入顺序
        List<PrintJob> sorted = new ArrayList<>(jobs);
        sorted.sort(Comparator.comparing(PrintJob::getTitle));

        List<JobBatch> batches = new ArrayList<>();
        List<PrintJob> current = new ArrayList<>();
        long currentTotal = 0L;
        for (PrintJob job : sorted) {
            if (currentTotal + job.getDurationMinutes() <= capacityMinutes) {
                current.add(job);
                currentTotal += job.getDurationMinutes();
                continue;
            }
            if (!current.isEmpty()) {
                batches.add(new JobBatch(batches.size() + 1, current));
            }
            if (job.getDurationMinutes() > capacityMinutes) {
                LOGGER.warn("Job {} ({} min) exceeds the batch capacity of {} min, it gets a batch of its own",
                        job.getId(), job.getDurationMinutes(), capacityMinutes);
            }
            current = new ArrayList<>();
            current.add(job);
            currentTotal = job.getDurationMinutes();
        }
        if (!current.isEmpty()) {
            batches.add(new JobBatch(batches.size() + 1, current));
        }
        LOGGER.debug("Partitioned {} jobs into {} batches (capacity {} min)", jobs.size(), batches.size(), capacityMinutes);
        return batches;
    }
}
