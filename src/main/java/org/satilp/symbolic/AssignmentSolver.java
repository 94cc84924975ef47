package org.satilp.symbolic;

import org.satilp.core.Assignment;
import org.satilp.expressions.linear.ConstraintSystem;
import org.satilp.expressions.linear.DecisionVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 把约束系统交给注入的 {@link IlpBackend}，并把结果解码为公式变量的赋值。
 * 辅助变量不会出现在返回的赋值中。
 */
public class AssignmentSolver {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentSolver.class);

    private final IlpBackend backend;

    public AssignmentSolver(IlpBackend backend) {
        this.backend = Objects.requireNonNull(backend, "IlpBackend cannot be null");
    }

    /**
     * 求解约束系统并解码。
     * @param system 编码器生成的约束系统。
     * @return 只包含原始公式变量的赋值。
     * @throws UnsatisfiableException 如果后端报告不可行。
     * @throws SolverFailedException 如果后端无法判定，或某个变量的取值不是 0/1。
     */
    public Assignment solve(ConstraintSystem system) throws UnsatisfiableException {
        Objects.requireNonNull(system, "ConstraintSystem cannot be null");
        IlpResult result = backend.solve(system);
        logger.debug("后端对 {} 的求解结果: {}", system.getName(), result);

        switch (result.getStatus()) {
            case FEASIBLE:
                return decode(system, result);
            case INFEASIBLE:
                logger.info("约束系统 {} 不可行", system.getName());
                throw new UnsatisfiableException(system.getName());
            default:
                logger.error("后端未能判定约束系统 {} 的可行性: {}", system.getName(), result.getReason());
                throw new SolverFailedException("后端未能判定约束系统 " + system.getName() + " 的可行性: " + result.getReason());
        }
    }

    private Assignment decode(ConstraintSystem system, IlpResult result) {
        Map<String, Boolean> values = new HashMap<>();
        for (Map.Entry<String, DecisionVariable> entry : system.getOriginalVariables().entrySet()) {
            DecisionVariable variable = entry.getValue();
            long value = result.getValue(variable).orElseThrow(() -> {
                logger.error("后端结果缺少决策变量 {} 的取值", variable);
                return new SolverFailedException("后端结果缺少决策变量 " + variable + " 的取值");
            });
            if (value != 0L && value != 1L) {
                logger.error("决策变量 {} 的取值 {} 不是 0 或 1", variable, value);
                throw new SolverFailedException("决策变量 " + variable + " 的取值不是 0 或 1: " + value);
            }
            values.put(entry.getKey(), value == 1L);
        }
        Assignment assignment = Assignment.of(values);
        logger.info("约束系统 {} 的解: {}", system.getName(), assignment);
        return assignment;
    }
}
