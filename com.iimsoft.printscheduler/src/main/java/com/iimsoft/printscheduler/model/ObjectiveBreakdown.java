package com.iimsoft.printscheduler.model;

import lombok.Data;

/**
 * 某个具体解的各目标项取值，以及按权重合成后的总目标值。
 */
@Data
public class ObjectiveBreakdown {

    private final long makespan;
    private final long proximityPenalty;
    private final long maxJobsPerPrinter;
    private final long totalStart;
    private final long printersUsed;
    private final long weightedTotal;
}
