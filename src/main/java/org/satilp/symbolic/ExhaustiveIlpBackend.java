package org.satilp.symbolic;

import org.satilp.expressions.linear.ConstraintSystem;
import org.satilp.expressions.linear.DecisionVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 穷举所有 0/1 取值的参考后端，只适用于小规模系统。
 * 按编号顺序把变量看作二进制位，返回第一个可行点。
 */
public class ExhaustiveIlpBackend implements IlpBackend {

    private static final Logger logger = LoggerFactory.getLogger(ExhaustiveIlpBackend.class);

    private final int variableLimit;

    public ExhaustiveIlpBackend() {
        this(SolverOptions.defaults());
    }

    public ExhaustiveIlpBackend(SolverOptions options) {
        this.variableLimit = options.getExhaustiveVariableLimit();
    }

    /**
     * @throws IllegalStateException 如果变量数超过限制。
     */
    @Override
    public IlpResult solve(ConstraintSystem system) {
        List<DecisionVariable> variables = new ArrayList<>(system.getVariables());
        if (variables.size() > variableLimit) {
            logger.error("约束系统 {} 有 {} 个变量，超过穷举上限 {}", system.getName(), variables.size(), variableLimit);
            throw new IllegalStateException("变量数 " + variables.size() + " 超过穷举上限 " + variableLimit);
        }

        long combinations = 1L << variables.size();
        Map<DecisionVariable, Long> values = new HashMap<>();
        for (long bits = 0; bits < combinations; bits++) {
            for (int i = 0; i < variables.size(); i++) {
                values.put(variables.get(i), (bits >>> i) & 1L);
            }
            if (system.isSatisfiedBy(values)) {
                logger.info("穷举求解 {}: 第 {} 个取值可行", system.getName(), bits);
                return IlpResult.feasible(values);
            }
        }
        logger.info("穷举求解 {}: {} 个取值均不可行", system.getName(), combinations);
        return IlpResult.infeasible();
    }
}
