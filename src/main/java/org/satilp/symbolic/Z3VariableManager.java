package org.satilp.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.Solver;
import lombok.Getter;
import org.satilp.expressions.linear.DecisionVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 负责管理决策变量到 Z3 整数变量的映射。
 * 确保每个决策变量在 Z3 Context 中有唯一的对应 Z3 变量。
 * 在 Solver 初始化时，断言所有已知决策变量的 0/1 取值范围。
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 每次求解新建一个实例，不会有并发问题
    private final Map<DecisionVariable, IntExpr> decisionZ3Vars;

    // 所有已知的决策变量，用于在 Solver 初始化时断言取值范围
    private final SortedSet<DecisionVariable> allKnownVariables;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     * @param allVariables 约束系统中的所有决策变量。
     */
    public Z3VariableManager(Context ctx, Collection<DecisionVariable> allVariables) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.allKnownVariables = Collections.unmodifiableSortedSet(new TreeSet<>(allVariables));
        this.decisionZ3Vars = new HashMap<>();

        // 预先创建所有已知变量的 Z3 变量并缓存
        for (DecisionVariable variable : allKnownVariables) {
            getZ3Var(variable);
        }

        logger.debug("Z3VariableManager 初始化完成，管理 {} 个决策变量。", allKnownVariables.size());
    }

    /**
     * 获取指定决策变量对应的 Z3 整数变量。
     * 如果变量尚未创建，则会创建并缓存。
     * @param variable 决策变量。
     * @return 对应的 Z3 IntExpr 变量。
     */
    public IntExpr getZ3Var(DecisionVariable variable) {
        return decisionZ3Vars.computeIfAbsent(variable, v -> {
            logger.debug("创建 Z3 整数变量: {}", v.getName());
            return ctx.mkIntConst(v.getName());
        });
    }

    /**
     * 向 Solver 断言所有已知决策变量的取值范围 0 <= v <= 1。
     * 此方法应在 Solver 首次初始化时调用。
     * @param solver Z3 Solver 实例。
     */
    public void assertBinaryDomains(Solver solver) {
        for (DecisionVariable variable : allKnownVariables) {
            IntExpr z3Var = getZ3Var(variable);
            solver.add(ctx.mkGe(z3Var, ctx.mkInt(0)), ctx.mkLe(z3Var, ctx.mkInt(1)));
            logger.debug("断言 Z3 约束: 0 <= {} <= 1", variable.getName());
        }
    }
}
