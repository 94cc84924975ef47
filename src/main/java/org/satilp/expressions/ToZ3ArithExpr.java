package org.satilp.expressions;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import org.satilp.symbolic.Z3VariableManager;


public interface ToZ3ArithExpr {

    /**
     * 将此对象转换为 Z3 整数算术表达式。
     * @param ctx Z3 Context 实例。
     * @param varManager Z3VariableManager 实例，用于管理决策变量到 Z3 变量的映射。
     * @return 对应的 Z3 ArithExpr。
     */
    ArithExpr<IntSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager);
}
