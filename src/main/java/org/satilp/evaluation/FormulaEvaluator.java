package org.satilp.evaluation;

import org.satilp.core.Assignment;
import org.satilp.core.Formula;
import org.satilp.core.Operand;
import org.satilp.core.Operator;
import org.satilp.core.UnboundVariableException;
import org.satilp.core.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 在给定赋值下对公式直接求布尔值。
 * 扁平节点和嵌套节点走同一条路径：逐个操作数取值，再按运算符合并。
 */
public final class FormulaEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(FormulaEvaluator.class);

    private FormulaEvaluator() {
    }

    /**
     * 计算公式在赋值下的真值。
     * 所有操作数都会被求值 (不短路)，因此任何未赋值的变量都会被报告。
     *
     * @param formula 公式。
     * @param assignment 变量赋值。
     * @return 公式的真值。
     * @throws UnboundVariableException 如果公式引用了赋值中不存在的变量。
     */
    public static boolean evaluate(Formula formula, Assignment assignment) {
        Objects.requireNonNull(formula, "Formula cannot be null");
        Objects.requireNonNull(assignment, "Assignment cannot be null");

        List<Boolean> values = new ArrayList<>(formula.getOperands().size());
        for (Operand operand : formula.getOperands()) {
            values.add(valueOf(operand, assignment));
        }
        boolean result = combine(formula.getOperator(), values);
        logger.debug("在赋值{}下计算了{}的结果为{}", assignment, formula, result);
        return result;
    }

    /**
     * 检查赋值是否满足公式。
     */
    public static boolean satisfies(Formula formula, Assignment assignment) {
        return evaluate(formula, assignment);
    }

    private static boolean valueOf(Operand operand, Assignment assignment) {
        if (operand instanceof Variable variable) {
            return assignment.getValue(variable.getName());
        }
        if (operand instanceof Formula sub) {
            return evaluate(sub, assignment);
        }
        throw new IllegalStateException("未知的操作数类型: " + operand.getClass().getName());
    }

    private static boolean combine(Operator operator, List<Boolean> values) {
        return switch (operator) {
            case NOT -> !values.get(0);
            case AND -> values.stream().allMatch(Boolean::booleanValue);
            case OR -> values.stream().anyMatch(Boolean::booleanValue);
        };
    }
}
