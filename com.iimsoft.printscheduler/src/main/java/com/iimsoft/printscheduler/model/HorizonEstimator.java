package com.iimsoft.printscheduler.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.iimsoft.printscheduler.config.SchedulingParameters;
import com.iimsoft.printscheduler.domain.MaterialTechnology;
import com.iimsoft.printscheduler.domain.PrintJob;
import com.iimsoft.printscheduler.domain.PrinterRoster;

/**
 * 按“最忙的 (材料, 工艺) 组合需要几天”估算批次时间窗：
 * <pre>
 * daysNeeded = max(组合总工时 / (班次分钟数 × 支持该组合的打印机数))
 * days       = floor(daysNeeded × 安全系数) + 余量天数
 * horizon    = days × 班次分钟数
 * </pre>
 * 总工时为 0 但批次非空时，用最小窗口 {@link #MIN_PLANNING_DAYS} 代替，保证时间窗不退化。
 */
public class HorizonEstimator {

    private static final Logger LOGGER = LoggerFactory.getLogger(HorizonEstimator.class);

    public static final double MIN_PLANNING_DAYS = 0.1;

    private final PrinterRoster roster;
    private final int shiftMinutes;
    private final double safetyFactor;
    private final int padDays;

    public HorizonEstimator(PrinterRoster roster, SchedulingParameters parameters) {
        this.roster = roster;
        this.shiftMinutes = parameters.getShiftLengthMinutes();
        this.safetyFactor = parameters.getHorizonSafetyFactor();
        this.padDays = parameters.getHorizonPadDays();
    }

    public HorizonEstimate estimate(List<PrintJob> jobs) {
        Map<MaterialTechnology, Long> workByPairing = new LinkedHashMap<>();
        for (PrintJob job : jobs) {
            workByPairing.merge(MaterialTechnology.of(job.getMaterial(), job.getTechnology()),
                    (long) job.getDurationMinutes(), Long::sum);
        }
        Map<MaterialTechnology, Long> printersByPairing = roster.countByPairing();

        double maxDaysNeeded = 0.0;
        MaterialTechnology busiest = null;
        List<MaterialTechnology> unsupported = new ArrayList<>();
        for (Map.Entry<MaterialTechnology, Long> e : workByPairing.entrySet()) {
            long printerCount = printersByPairing.getOrDefault(e.getKey(), 0L);
            if (printerCount == 0) {
                // 这些任务大概率无解，留到求解阶段再体现
                LOGGER.warn("Batch contains {} min of {} work but no printer supports that pairing",
                        e.getValue(), e.getKey());
                unsupported.add(e.getKey());
                continue;
            }
            double daysNeeded = (double) e.getValue() / ((double) shiftMinutes * printerCount);
            if (daysNeeded > maxDaysNeeded) {
                maxDaysNeeded = daysNeeded;
                busiest = e.getKey();
            }
        }

        boolean degenerate = false;
        if (maxDaysNeeded == 0.0 && !jobs.isEmpty()) {
            LOGGER.warn("No estimated work for a batch of {} jobs, using the minimum planning window of {} days",
                    jobs.size(), MIN_PLANNING_DAYS);
            maxDaysNeeded = MIN_PLANNING_DAYS;
            degenerate = true;
        }

        long days = Math.max(1L, (long) Math.floor(maxDaysNeeded * safetyFactor) + padDays);
        long horizon = days * shiftMinutes;
        if (horizon > Integer.MAX_VALUE / 2) {
            throw new IllegalStateException("Horizon of " + horizon + " min is too large, split the batch further");
        }
        LOGGER.debug("Horizon estimate: busiest {} needs {} days, planning {} days = {} min",
                busiest, String.format("%.2f", maxDaysNeeded), days, horizon);
        return new HorizonEstimate((int) horizon, days, maxDaysNeeded, busiest, unsupported, degenerate);
    }
}
