package com.iimsoft.printscheduler.solver;

public enum SolveStatus {
    OPTIMAL,
    FEASIBLE,
    /** 证明无解。 */
    INFEASIBLE,
    /** 时间耗尽仍未找到可行解，或求解器无法给出结论。 */
    UNKNOWN;

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
