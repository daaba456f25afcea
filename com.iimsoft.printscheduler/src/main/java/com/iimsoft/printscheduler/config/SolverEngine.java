package com.iimsoft.printscheduler.config;

public enum SolverEngine {
    /** OptaPlanner 约束流 + 局部搜索。 */
    OPTAPLANNER,
    /** Google OR-Tools CP-SAT。 */
    CP_SAT
}
