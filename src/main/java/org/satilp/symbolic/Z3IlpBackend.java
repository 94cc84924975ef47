package org.satilp.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import lombok.Getter;
import org.satilp.expressions.linear.ConstraintSystem;
import org.satilp.expressions.linear.DecisionVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 基于 Z3 整数线性算术的 ILP 后端。
 * 每个决策变量对应一个 Z3 整数常量并被限制在 [0, 1] 内，约束系统作为一个合取式断言。
 * 持有一个 Z3 Context，用完必须 {@link #close()}。非线程安全。
 * 每次求解使用新的 Solver，返回前将其 reset；Z3 常量由 Context 持有，直到 close 时才释放，
 * 因此同一实例可以反复求解，但长期运行时应定期换用新实例。
 */
@Getter
public class Z3IlpBackend implements IlpBackend, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3IlpBackend.class);

    private final Context context;

    private final SolverOptions options;

    public Z3IlpBackend() {
        this(SolverOptions.defaults());
    }

    public Z3IlpBackend(SolverOptions options) {
        this.options = Objects.requireNonNull(options, "SolverOptions cannot be null");
        this.context = new Context();
        logger.debug("Z3IlpBackend 初始化完成: {}", options);
    }

    @Override
    public IlpResult solve(ConstraintSystem system) {
        Objects.requireNonNull(system, "ConstraintSystem cannot be null");
        Z3VariableManager varManager = new Z3VariableManager(context, system.getVariables());

        Solver solver = context.mkSolver();
        if (options.getTimeoutMillis() > 0) {
            Params params = context.mkParams();
            params.add("timeout", options.getTimeoutMillis());
            solver.setParameters(params);
        }
        try {
            varManager.assertBinaryDomains(solver);
            solver.add(system.toZ3BoolExpr(context, varManager));

            logger.info("调用 Z3 求解 {}: {} 个变量, {} 条约束",
                    system.getName(), system.getVariables().size(), system.getConstraints().size());
            Status status = solver.check();
            logger.info("Z3 求解 {} 的结果为 {}", system.getName(), status);

            switch (status) {
                case SATISFIABLE:
                    return IlpResult.feasible(readModel(solver.getModel(), system, varManager));
                case UNSATISFIABLE:
                    return IlpResult.infeasible();
                default:
                    String reason = solver.getReasonUnknown();
                    logger.warn("Z3 未能判定 {} 的可行性: {}", system.getName(), reason);
                    return IlpResult.unknown(reason);
            }
        } finally {
            // 模型已读出，清空断言以便 Context 回收
            solver.reset();
        }
    }

    private Map<DecisionVariable, Long> readModel(Model model, ConstraintSystem system, Z3VariableManager varManager) {
        Map<DecisionVariable, Long> values = new HashMap<>();
        for (DecisionVariable variable : system.getVariables()) {
            Expr<IntSort> value = model.evaluate(varManager.getZ3Var(variable), true);
            if (!(value instanceof IntNum)) {
                logger.error("Z3 模型中变量 {} 的值不是整数常量: {}", variable, value);
                throw new SolverFailedException("Z3 模型中变量 " + variable + " 的值不是整数常量: " + value);
            }
            values.put(variable, ((IntNum) value).getInt64());
        }
        logger.debug("Z3 模型: {}", values);
        return values;
    }

    @Override
    public void close() {
        context.close();
        logger.debug("Z3IlpBackend 已关闭");
    }
}
