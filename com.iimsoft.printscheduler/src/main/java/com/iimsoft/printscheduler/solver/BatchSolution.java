package com.iimsoft.printscheduler.solver;

import java.util.List;

import com.iimsoft.printscheduler.domain.ScheduledJob;
import com.iimsoft.printscheduler.model.BatchModel;
import com.iimsoft.printscheduler.model.ObjectiveBreakdown;

/**
 * 一个批次校验通过的解。时间尚未加批次偏移。
 */
public class BatchSolution {

    private final BatchModel model;
    private final SolveOutcome outcome;
    private final List<ScheduledJob> scheduledJobs;
    private final ObjectiveBreakdown objective;

    public BatchSolution(BatchModel model, SolveOutcome outcome, List<ScheduledJob> scheduledJobs,
                         ObjectiveBreakdown objective) {
        this.model = model;
        this.outcome = outcome;
        this.scheduledJobs = List.copyOf(scheduledJobs);
        this.objective = objective;
    }

    public BatchModel getModel() { return model; }
    public SolveOutcome getOutcome() { return outcome; }
    public List<ScheduledJob> getScheduledJobs() { return scheduledJobs; }
    public ObjectiveBreakdown getObjective() { return objective; }

    /** 实际的邻近完工惩罚值，诊断用。 */
    public long getProximityPenalty() {
        return objective.getProximityPenalty();
    }
}
