package com.iimsoft.printscheduler.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.iimsoft.printscheduler.domain.Printer;

/**
 * 生成邻近完工惩罚要比较的任务对。
 *
 * 不做全量两两比较：按名义时长稳定排序后，每个任务只看后面 lookahead - 1 个任务，
 * 遇到时长差超过 durationGapMinutes 的就停止。lookahead 越大越完整，模型也越大。
 */
public class ProximityWindow {

    private final int lookahead;
    private final int durationGapMinutes;
    private final int thresholdMinutes;

    public ProximityWindow(int lookahead, int durationGapMinutes, int thresholdMinutes) {
        this.lookahead = lookahead;
        this.durationGapMinutes = durationGapMinutes;
        this.thresholdMinutes = thresholdMinutes;
    }

    public List<ProximityPair> pairs(List<JobSlot> slots) {
        List<JobSlot> byDuration = new ArrayList<>(slots);
        byDuration.sort(Comparator.comparingInt(JobSlot::getNominalDuration));

        List<ProximityPair> pairs = new ArrayList<>();
        int n = byDuration.size();
        for (int i = 0; i < n; i++) {
            JobSlot left = byDuration.get(i);
            int last = Math.min(i + lookahead, n);
            for (int j = i + 1; j < last; j++) {
                JobSlot right = byDuration.get(j);
                if (Math.abs(left.getNominalDuration() - right.getNominalDuration()) > durationGapMinutes) {
                    break;
                }
                if (!Printer.normalize(left.getJob().getTechnology())
                        .equals(Printer.normalize(right.getJob().getTechnology()))) {
                    continue;
                }
                pairs.add(new ProximityPair(left.getIndex(), right.getIndex(), thresholdMinutes));
            }
        }
        return pairs;
    }

    public int getLookahead() { return lookahead; }
    public int getDurationGapMinutes() { return durationGapMinutes; }
    public int getThresholdMinutes() { return thresholdMinutes; }
}
