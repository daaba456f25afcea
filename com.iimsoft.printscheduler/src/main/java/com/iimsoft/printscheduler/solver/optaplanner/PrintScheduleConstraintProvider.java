package com.iimsoft.printscheduler.solver.optaplanner;

import java.util.Collections;
import java.util.Objects;

import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;
import org.optaplanner.core.api.score.stream.Constraint;
import org.optaplanner.core.api.score.stream.ConstraintCollectors;
import org.optaplanner.core.api.score.stream.ConstraintFactory;
import org.optaplanner.core.api.score.stream.ConstraintProvider;
import org.optaplanner.core.api.score.stream.Joiners;

import com.iimsoft.printscheduler.domain.Printer;
import com.iimsoft.printscheduler.model.ObjectiveWeights;
import com.iimsoft.printscheduler.model.ProximityPair;

/**
 * 基于 Constraint Streams 的评分器。
 *
 * Hard：
 * - 同一台打印机上的任务区间（含缓冲）不能重叠；
 * - 任务必须落在批次时间窗内（值域已保证，这里兜底计分）。
 *
 * Soft（权重来自 {@link ObjectiveWeights} 问题事实，可由调用方调整）：
 * - makespan、邻近完工惩罚、负载均衡、开工时间和、使用的打印机数。
 */
public class PrintScheduleConstraintProvider implements ConstraintProvider {

    @Override
    public Constraint[] defineConstraints(ConstraintFactory constraintFactory) {
        return new Constraint[] {
                printerConflict(constraintFactory),
                horizonContainment(constraintFactory),
                makespan(constraintFactory),
                proximityPenalty(constraintFactory),
                loadBalance(constraintFactory),
                totalStartTime(constraintFactory),
                printersUsed(constraintFactory)
        };
    }

    // ----------------------------------------------------------------
    // Hard
    // ----------------------------------------------------------------

    Constraint printerConflict(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(JobAllocation.class)
                .filter(JobAllocation::isAssigned)
                .join(JobAllocation.class,
                        Joiners.equal(JobAllocation::getPrinter),
                        Joiners.lessThan(JobAllocation::getId))
                .filter((a1, a2) -> a2.isAssigned()
                        && a1.getStart() < a2.getEnd() && a2.getStart() < a1.getEnd())
                // 罚重叠的分钟数，方便局部搜索逐步消除冲突
                .penalizeLong(HardSoftLongScore.ONE_HARD,
                        (a1, a2) -> Math.min(a1.getEnd(), a2.getEnd()) - Math.max(a1.getStart(), a2.getStart()))
                .asConstraint("Printer conflict");
    }

    Constraint horizonContainment(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(JobAllocation.class)
                .filter(JobAllocation::isAssigned)
                .filter(a -> a.getStart() < a.getSlot().getStartMin() || a.getStart() > a.getSlot().getStartMax())
                .penalizeLong(HardSoftLongScore.ONE_HARD,
                        a -> Math.max(a.getSlot().getStartMin() - a.getStart(), a.getStart() - a.getSlot().getStartMax()))
                .asConstraint("Horizon containment");
    }

    // ----------------------------------------------------------------
    // Soft
    // ----------------------------------------------------------------

    Constraint makespan(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(JobAllocation.class)
                .filter(JobAllocation::isAssigned)
                .groupBy(ConstraintCollectors.max(JobAllocation::getTrueEnd))
                .join(ObjectiveWeights.class)
                .penalizeLong(HardSoftLongScore.ONE_SOFT,
                        (maxTrueEnd, weights) -> weights.getMakespanWeight() * maxTrueEnd)
                .asConstraint("Makespan");
    }

    Constraint proximityPenalty(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(ProximityPair.class)
                .join(JobAllocation.class,
                        Joiners.equal(ProximityPair::getLeftSlot, JobAllocation::getSlotIndex))
                .join(JobAllocation.class,
                        Joiners.equal((pair, left) -> pair.getRightSlot(), JobAllocation::getSlotIndex))
                .filter((pair, left, right) -> left.isAssigned() && right.isAssigned()
                        && pair.penalizes(left.getTrueEnd(), right.getTrueEnd(),
                        Objects.equals(left.getRack(), right.getRack())))
                .join(ObjectiveWeights.class)
                .penalizeLong(HardSoftLongScore.ONE_SOFT,
                        (pair, left, right, weights) -> weights.getProximityWeight())
                .asConstraint("Proximity penalty");
    }

    Constraint loadBalance(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(JobAllocation.class)
                .filter(JobAllocation::isAssigned)
                .groupBy(JobAllocation::getPrinter, ConstraintCollectors.count())
                .groupBy(ConstraintCollectors.toList((Printer printer, Integer count) -> count))
                // 求解过程中分配被撤回时，分组结果可能是空列表
                .filter(counts -> !counts.isEmpty())
                .join(ObjectiveWeights.class)
                // 只罚最忙那台打印机的任务数
                .penalizeLong(HardSoftLongScore.ONE_SOFT,
                        (counts, weights) -> weights.getLoadBalanceWeight() * Collections.max(counts))
                .asConstraint("Load balance");
    }

    Constraint totalStartTime(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(JobAllocation.class)
                .filter(JobAllocation::isAssigned)
                .join(ObjectiveWeights.class)
                .penalizeLong(HardSoftLongScore.ONE_SOFT,
                        (allocation, weights) -> weights.getTieBreakWeight() * allocation.getStart())
                .asConstraint("Total start time");
    }

    Constraint printersUsed(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(JobAllocation.class)
                .filter(JobAllocation::isAssigned)
                .groupBy(JobAllocation::getPrinter)
                .join(ObjectiveWeights.class)
                .penalizeLong(HardSoftLongScore.ONE_SOFT, (printer, weights) -> weights.getPrinterUsageWeight())
                .asConstraint("Printers used");
    }
}
