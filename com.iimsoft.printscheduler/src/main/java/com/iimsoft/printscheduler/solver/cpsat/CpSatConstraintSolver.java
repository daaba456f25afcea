package com.iimsoft.printscheduler.solver.cpsat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.ortools.Loader;
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.IntervalVar;
import com.google.ortools.sat.LinearArgument;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.google.ortools.sat.Literal;
import com.google.ortools.util.Domain;
import com.iimsoft.printscheduler.domain.Printer;
import com.iimsoft.printscheduler.domain.PrinterRoster;
import com.iimsoft.printscheduler.model.BatchModel;
import com.iimsoft.printscheduler.model.JobSlot;
import com.iimsoft.printscheduler.model.NoOverlapGroup;
import com.iimsoft.printscheduler.model.ObjectiveWeights;
import com.iimsoft.printscheduler.model.ProximityPair;
import com.iimsoft.printscheduler.model.SlotAssignment;
import com.iimsoft.printscheduler.solver.ConstraintSolver;
import com.iimsoft.printscheduler.solver.SolveOutcome;
import com.iimsoft.printscheduler.solver.SolveStatus;

/**
 * 基于 OR-Tools CP-SAT 的求解引擎，按 {@link BatchModel} 逐条建模：
 * 指示变量 + 可选区间 + 每台打印机一个 NoOverlap，机架变量经指示变量绑定，
 * 邻近惩罚双向具体化（penalized ⇔ close ∧ 不同机架）。
 */
public class CpSatConstraintSolver implements ConstraintSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(CpSatConstraintSolver.class);

    private static boolean nativeLoaded = false;

    private final int numWorkers;

    public static final int DEFAULT_NUM_WORKERS = 8;

    public CpSatConstraintSolver() {
        this(DEFAULT_NUM_WORKERS);
    }

    public CpSatConstraintSolver(int numWorkers) {
        if (numWorkers < 1) {
            throw new IllegalArgumentException("numWorkers must be >= 1, got " + numWorkers);
        }
        this.numWorkers = numWorkers;
    }

    public int getNumWorkers() {
        return numWorkers;
    }

    /**
     * 本地库只加载一次。加载失败时抛出 {@link LinkageError}，由调用方决定如何处理。
     */
    public static synchronized void ensureNativeLoaded() {
        if (!nativeLoaded) {
            Loader.loadNativeLibraries();
            nativeLoaded = true;
        }
    }

    @Override
    public SolveOutcome solve(BatchModel batchModel, Duration timeLimit) {
        ensureNativeLoaded();

        CpModel model = new CpModel();
        PrinterRoster roster = batchModel.getRoster();
        List<JobSlot> slots = batchModel.getSlots();
        ObjectiveWeights weights = batchModel.getWeights();
        int horizon = batchModel.getHorizon();
        int n = slots.size();

        // =============================================
        // DECISION VARIABLES
        // =============================================
        IntVar[] start = new IntVar[n];
        IntVar[] end = new IntVar[n];
        IntVar[] printer = new IntVar[n];
        IntVar[] rack = new IntVar[n];
        // key = slotIndex -> (printerId -> indicator)
        List<Map<Long, BoolVar>> uses = new ArrayList<>();
        int maxRackId = roster.getRackIds().stream().mapToInt(Integer::intValue).max().orElse(0);

        for (JobSlot slot : slots) {
            int i = slot.getIndex();
            String name = "j" + slot.getJob().getId();
            start[i] = model.newIntVar(slot.getStartMin(), slot.getStartMax(), "start_" + name);
            end[i] = model.newIntVar(slot.getStartMin() + slot.getEffectiveDuration(), horizon, "end_" + name);
            model.addEquality(end[i], LinearExpr.newBuilder().add(start[i]).add(slot.getEffectiveDuration()).build());

            printer[i] = model.newIntVarFromDomain(Domain.fromValues(slot.getPrinterIdDomain()), "printer_" + name);
            rack[i] = model.newIntVar(0, maxRackId, "rack_" + name);

            Map<Long, BoolVar> indicators = new HashMap<>();
            for (Printer p : slot.getCompatiblePrinters()) {
                BoolVar lit = model.newBoolVar("uses_" + name + "_p" + p.getId());
                model.addEquality(printer[i], p.getId()).onlyEnforceIf(lit);
                model.addDifferent(printer[i], p.getId()).onlyEnforceIf(lit.not());
                model.addEquality(rack[i], roster.rackIdOf(p)).onlyEnforceIf(lit);
                indicators.put(p.getId(), lit);
            }
            model.addExactlyOne(indicators.values().toArray(new Literal[0]));
            uses.add(indicators);
        }

        // =============================================
        // HARD: 每台打印机上的可选区间互斥
        // =============================================
        IntVar[] loadPerPrinter = new IntVar[batchModel.getNoOverlapGroups().size()];
        BoolVar[] printerUsed = new BoolVar[loadPerPrinter.length];
        int g = 0;
        for (NoOverlapGroup group : batchModel.getNoOverlapGroups()) {
            long pid = group.getPrinter().getId();
            List<IntervalVar> intervals = new ArrayList<>();
            List<BoolVar> lits = new ArrayList<>();
            for (int i : group.getSlotIndexes()) {
                BoolVar lit = uses.get(i).get(pid);
                lits.add(lit);
                intervals.add(model.newOptionalIntervalVar(start[i], LinearExpr.constant(slots.get(i).getEffectiveDuration()),
                        end[i], lit, "interval_j" + slots.get(i).getJob().getId() + "_p" + pid));
            }
            model.addNoOverlap(intervals);

            loadPerPrinter[g] = model.newIntVar(0, lits.size(), "load_p" + pid);
            model.addEquality(loadPerPrinter[g], LinearExpr.sum(lits.toArray(new BoolVar[0])));
            printerUsed[g] = model.newBoolVar("used_p" + pid);
            model.addMaxEquality(printerUsed[g], lits.toArray(new LinearArgument[0]));
            g++;
        }

        // =============================================
        // OBJECTIVE
        // =============================================
        LinearArgument[] trueEnds = new LinearArgument[n];
        for (JobSlot slot : slots) {
            trueEnds[slot.getIndex()] = LinearExpr.newBuilder().add(start[slot.getIndex()])
                    .add(slot.getNominalDuration()).build();
        }
        IntVar makespan = model.newIntVar(0, horizon, "makespan");
        model.addMaxEquality(makespan, trueEnds);

        LinearExprBuilder objective = LinearExpr.newBuilder();
        objective.addTerm(makespan, weights.getMakespanWeight());

        if (weights.usesProximity()) {
            for (ProximityPair pair : batchModel.getProximityPairs()) {
                objective.addTerm(penalized(model, pair, slots, start, rack, horizon), weights.getProximityWeight());
            }
        }
        if (weights.usesLoadBalance() && loadPerPrinter.length > 0) {
            IntVar maxLoad = model.newIntVar(0, n, "max_load");
            model.addMaxEquality(maxLoad, loadPerPrinter);
            objective.addTerm(maxLoad, weights.getLoadBalanceWeight());
        }
        if (weights.usesPrinterUsage()) {
            for (BoolVar used : printerUsed) {
                objective.addTerm(used, weights.getPrinterUsageWeight());
            }
        }
        for (IntVar s : start) {
            objective.addTerm(s, weights.getTieBreakWeight());
        }
        model.minimize(objective.build());

        // =============================================
        // SOLVE
        // =============================================
        CpSolver solver = new CpSolver();
        solver.getParameters().setMaxTimeInSeconds(timeLimit.toMillis() / 1000.0);
        solver.getParameters().setNumWorkers(numWorkers);

        long begin = System.nanoTime();
        CpSolverStatus status = solver.solve(model);
        Duration wallTime = Duration.ofNanos(System.nanoTime() - begin);
        LOGGER.debug("Batch {} CP-SAT status {}, {}", batchModel.getBatchNumber(), status, solver.responseStats());

        SolveStatus solveStatus = toSolveStatus(status);
        if (!solveStatus.hasSolution()) {
            return SolveOutcome.noSolution(solveStatus, wallTime, "CP-SAT " + status);
        }

        List<SlotAssignment> assignments = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            assignments.add(new SlotAssignment(i, solver.value(printer[i]), solver.value(start[i]), solver.value(end[i])));
        }
        return SolveOutcome.solved(solveStatus, assignments, wallTime, "objective " + (long) solver.objectiveValue());
    }

    /**
     * 一对任务的惩罚变量：真实完工时间差不超过阈值且机架不同，两个方向都约束。
     */
    private static BoolVar penalized(CpModel model, ProximityPair pair, List<JobSlot> slots, IntVar[] start,
                                     IntVar[] rack, int horizon) {
        int l = pair.getLeftSlot();
        int r = pair.getRightSlot();
        String name = l + "_" + r;

        IntVar diff = model.newIntVar(-horizon, horizon, "diff_" + name);
        model.addEquality(diff, LinearExpr.newBuilder()
                .addTerm(start[l], 1).addTerm(start[r], -1)
                .add(slots.get(l).getNominalDuration() - slots.get(r).getNominalDuration())
                .build());
        IntVar absDiff = model.newIntVar(0, horizon, "absdiff_" + name);
        model.addAbsEquality(absDiff, diff);

        BoolVar close = model.newBoolVar("close_" + name);
        model.addLessOrEqual(absDiff, pair.getThresholdMinutes()).onlyEnforceIf(close);
        model.addGreaterThan(absDiff, pair.getThresholdMinutes()).onlyEnforceIf(close.not());

        BoolVar diffRack = model.newBoolVar("diffrack_" + name);
        model.addDifferent(rack[l], rack[r]).onlyEnforceIf(diffRack);
        model.addEquality(rack[l], rack[r]).onlyEnforceIf(diffRack.not());

        BoolVar penalized = model.newBoolVar("penalized_" + name);
        model.addBoolAnd(new Literal[] { close, diffRack }).onlyEnforceIf(penalized);
        model.addBoolOr(new Literal[] { close.not(), diffRack.not(), penalized });
        return penalized;
    }

    static SolveStatus toSolveStatus(CpSolverStatus status) {
        switch (status) {
            case OPTIMAL:
                return SolveStatus.OPTIMAL;
            case FEASIBLE:
                return SolveStatus.FEASIBLE;
            case INFEASIBLE:
                return SolveStatus.INFEASIBLE;
            default:
                return SolveStatus.UNKNOWN;
        }
    }

    @Override
    public String getName() {
        return "CP-SAT";
    }
}
