package org.satilp.symbolic;

import org.satilp.expressions.linear.ConstraintSystem;

/**
 * 外部 ILP 求解后端：接受二值决策变量和线性约束，报告可行 (附带变量取值) 或不可行。
 * 只需要可行性，不需要目标函数。
 * 后端自身的错误 (例如本地库不可用) 直接以异常形式抛出，不能报告为 INFEASIBLE。
 */
public interface IlpBackend {

    /**
     * 求解约束系统。
     * @param system 约束系统。
     * @return 求解结果，FEASIBLE 时必须包含系统中每个决策变量的取值。
     */
    IlpResult solve(ConstraintSystem system);
}
