package com.iimsoft.printscheduler.model;

import static com.iimsoft.printscheduler.TestFixtures.core;
import static com.iimsoft.printscheduler.TestFixtures.roster;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.iimsoft.printscheduler.config.SchedulingParameters;
import com.iimsoft.printscheduler.domain.JobBatch;
import com.iimsoft.printscheduler.domain.PrintJob;
import com.iimsoft.printscheduler.domain.PrinterRoster;

class ObjectiveComposerTest {

    // 两台兼容打印机在不同机架
    private final PrinterRoster roster = roster(core(1, "PETG", "1"), core(2, "PETG", "2"));

    @Test
    void compositeWeightsComeFromParameters() {
        SchedulingParameters parameters = new SchedulingParameters();
        parameters.setLoadBalanceWeight(7);

        ObjectiveWeights weights = new ObjectiveComposer(parameters).compose(11);

        assertEquals(new ObjectiveWeights(1, 5, 7, 1, 0), weights);
    }

    @Test
    void alternativeObjectiveWeighsMakespanAbovePrinterCount() {
        SchedulingParameters parameters = new SchedulingParameters();
        parameters.setObjectiveType(ObjectiveType.MAKESPAN_AND_PRINTERS);

        ObjectiveWeights weights = new ObjectiveComposer(parameters).compose(11);

        assertEquals(new ObjectiveWeights(12, 0, 0, 1, 1), weights);
    }

    @Test
    void closeEndsOnDifferentRacksArePenalized() {
        BatchModel model = model(15);

        // 完工时间 510 和 520，相差 10
        ObjectiveBreakdown close = ObjectiveComposer.evaluate(model, List.of(
                new SlotAssignment(0, 1, 480, 510), new SlotAssignment(1, 2, 490, 520)));
        assertEquals(1, close.getProximityPenalty());

        // 相差 20
        ObjectiveBreakdown apart = ObjectiveComposer.evaluate(model, List.of(
                new SlotAssignment(0, 1, 480, 510), new SlotAssignment(1, 2, 500, 530)));
        assertEquals(0, apart.getProximityPenalty());
    }

    @Test
    void breakdownSumsWeightedTerms() {
        BatchModel model = model(15);

        ObjectiveBreakdown breakdown = ObjectiveComposer.evaluate(model, List.of(
                new SlotAssignment(0, 1, 480, 510), new SlotAssignment(1, 1, 510, 540)));

        assertEquals(540, breakdown.getMakespan());
        assertEquals(0, breakdown.getProximityPenalty());
        assertEquals(2, breakdown.getMaxJobsPerPrinter());
        assertEquals(990, breakdown.getTotalStart());
        assertEquals(1, breakdown.getPrintersUsed());
        // 540 + 5*0 + 30*2 + 990
        assertEquals(1590, breakdown.getWeightedTotal());
    }

    private BatchModel model(int threshold) {
        SchedulingParameters parameters = new SchedulingParameters();
        parameters.setProximityThresholdMinutes(threshold);
        JobBatch batch = new JobBatch(1, List.of(
                new PrintJob(1, "A", "PETG", "FDM", "Core One", 30),
                new PrintJob(2, "B", "PETG", "FDM", "Core One", 30)));
        HorizonEstimate horizon = new HorizonEstimate(1440, 2, 0.1, null, List.of(), false);
        return new ConstraintModelBuilder(roster, parameters, new ObjectiveComposer(parameters)).build(batch, horizon);
    }
}
