package com.iimsoft.printscheduler.solver;

import java.time.Duration;

import com.iimsoft.printscheduler.model.BatchModel;

/**
 * 可替换的约束求解能力：接收模型描述，在时间预算内返回完整解或无解信号。
 * 实现不得返回部分解，也不得超出预算太多。
 */
public interface ConstraintSolver {

    SolveOutcome solve(BatchModel model, Duration timeLimit);

    String getName();
}
