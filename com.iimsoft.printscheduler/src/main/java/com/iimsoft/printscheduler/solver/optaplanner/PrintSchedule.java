package com.iimsoft.printscheduler.solver.optaplanner;

import java.util.List;

import org.optaplanner.core.api.domain.solution.PlanningEntityCollectionProperty;
import org.optaplanner.core.api.domain.solution.PlanningScore;
import org.optaplanner.core.api.domain.solution.PlanningSolution;
import org.optaplanner.core.api.domain.solution.ProblemFactCollectionProperty;
import org.optaplanner.core.api.domain.solution.ProblemFactProperty;
import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;

import com.iimsoft.printscheduler.domain.Printer;
import com.iimsoft.printscheduler.model.ObjectiveWeights;
import com.iimsoft.printscheduler.model.ProximityPair;

/**
 * 单个批次的 OptaPlanner 规划解。
 */
@PlanningSolution
public class PrintSchedule {

    @ProblemFactCollectionProperty
    private List<Printer> printerList;

    @ProblemFactCollectionProperty
    private List<ProximityPair> proximityPairList;

    @ProblemFactProperty
    private ObjectiveWeights objectiveWeights;

    @PlanningEntityCollectionProperty
    private List<JobAllocation> allocationList;

    @PlanningScore
    private HardSoftLongScore score;

    public PrintSchedule() {
    }

    public PrintSchedule(List<Printer> printerList, List<ProximityPair> proximityPairList,
                         ObjectiveWeights objectiveWeights, List<JobAllocation> allocationList) {
        this.printerList = printerList;
        this.proximityPairList = proximityPairList;
        this.objectiveWeights = objectiveWeights;
        this.allocationList = allocationList;
    }

    public List<Printer> getPrinterList() { return printerList; }
    public void setPrinterList(List<Printer> printerList) { this.printerList = printerList; }
    public List<ProximityPair> getProximityPairList() { return proximityPairList; }
    public void setProximityPairList(List<ProximityPair> proximityPairList) { this.proximityPairList = proximityPairList; }
    public ObjectiveWeights getObjectiveWeights() { return objectiveWeights; }
    public void setObjectiveWeights(ObjectiveWeights objectiveWeights) { this.objectiveWeights = objectiveWeights; }
    public List<JobAllocation> getAllocationList() { return allocationList; }
    public void setAllocationList(List<JobAllocation> allocationList) { this.allocationList = allocationList; }
    public HardSoftLongScore getScore() { return score; }
    public void setScore(HardSoftLongScore score) { this.score = score; }
}
