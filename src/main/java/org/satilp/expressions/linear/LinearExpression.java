package org.satilp.expressions.linear;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import lombok.Getter;
import org.satilp.expressions.ToZ3ArithExpr;
import org.satilp.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 代表决策变量上的整数线性表达式，形式为 c1*v1 + c2*v2 + ... + const。
 * 此类是不可变的。
 */
@Getter
public final class LinearExpression implements ToZ3ArithExpr {

    private static final Logger logger = LoggerFactory.getLogger(LinearExpression.class);

    private final SortedMap<DecisionVariable, Long> coefficients;

    private final long constant;

    private final int hashCode;

    /**
     * 私有构造函数。
     * @param coefficients 决策变量到其系数的映射。
     * @param constant 常数项。
     */
    private LinearExpression(Map<DecisionVariable, Long> coefficients, long constant) {
        // 拷贝并确保有序性，同时过滤掉系数为零的变量
        Map<DecisionVariable, Long> tempCoefficients = new HashMap<>();
        for (Map.Entry<DecisionVariable, Long> entry : Objects.requireNonNull(coefficients, "Coefficients map cannot be null").entrySet()) {
            DecisionVariable variable = Objects.requireNonNull(entry.getKey(), "Variable in coefficients map cannot be null");
            Long coeff = Objects.requireNonNull(entry.getValue(), "Coefficient cannot be null");
            if (coeff != 0L) {
                tempCoefficients.put(variable, coeff);
            }
        }
        this.coefficients = Collections.unmodifiableSortedMap(new TreeMap<>(tempCoefficients));
        this.constant = constant;
        this.hashCode = Objects.hash(this.coefficients, this.constant);
    }

    public static LinearExpression of(Map<DecisionVariable, Long> coefficients, long constant) {
        return new LinearExpression(coefficients, constant);
    }

    public static LinearExpression of(long constant) {
        return new LinearExpression(Collections.emptyMap(), constant);
    }

    /**
     * 工厂方法：只包含一个变量的表达式 (例如 v1)。
     */
    public static LinearExpression of(DecisionVariable variable) {
        return new LinearExpression(Map.of(variable, 1L), 0);
    }

    public static LinearExpression of(DecisionVariable variable, long coefficient) {
        return new LinearExpression(Map.of(variable, coefficient), 0);
    }

    /**
     * 工厂方法：一组变量之和 (例如 v1 + v2 + v3)。同一变量出现多次时系数累加。
     * @param variables 变量集合。
     * @return 求和表达式。
     */
    public static LinearExpression sum(Collection<DecisionVariable> variables) {
        Map<DecisionVariable, Long> coefficients = new HashMap<>();
        for (DecisionVariable variable : variables) {
            coefficients.merge(variable, 1L, Long::sum);
        }
        return new LinearExpression(coefficients, 0);
    }

    /**
     * 将此表达式与另一个表达式相加。
     * @param other 另一个 LinearExpression。
     * @return 相加后的新 LinearExpression。
     */
    public LinearExpression add(LinearExpression other) {
        Map<DecisionVariable, Long> newCoefficients = new HashMap<>(this.coefficients);
        other.coefficients.forEach((variable, value) -> newCoefficients.merge(variable, value, Long::sum));
        return new LinearExpression(newCoefficients, this.constant + other.constant);
    }

    public LinearExpression add(long value) {
        return new LinearExpression(this.coefficients, this.constant + value);
    }

    /**
     * 将此表达式减去另一个表达式。
     * @param other 另一个 LinearExpression。
     * @return 相减后的新 LinearExpression。
     */
    public LinearExpression subtract(LinearExpression other) {
        Map<DecisionVariable, Long> newCoefficients = new HashMap<>(this.coefficients);
        other.coefficients.forEach((variable, value) -> newCoefficients.merge(variable, -value, Long::sum)); // 减去相当于加上负数
        return new LinearExpression(newCoefficients, this.constant - other.constant);
    }

    /**
     * @return 如果表达式不含任何变量则返回 true。
     */
    public boolean isConstant() {
        return coefficients.isEmpty();
    }

    /**
     * 根据给定的变量取值，计算表达式的具体数值。
     * @param values 决策变量的取值。
     * @return 表达式的值。
     * @throws IllegalArgumentException 如果缺少某个变量的取值。
     */
    public long evaluate(Map<DecisionVariable, Long> values) {
        long result = this.constant;
        for (Map.Entry<DecisionVariable, Long> entry : coefficients.entrySet()) {
            Long value = values.get(entry.getKey());
            if (value == null) {
                logger.error("计算{}时缺少变量{}的取值", this, entry.getKey());
                throw new IllegalArgumentException("缺少决策变量 '" + entry.getKey() + "' 的取值");
            }
            result += entry.getValue() * value;
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        boolean firstTerm = true;

        // 遍历有序的系数，确保输出顺序稳定
        for (Map.Entry<DecisionVariable, Long> entry : coefficients.entrySet()) {
            long coeff = entry.getValue();
            if (firstTerm) {
                if (coeff < 0) {
                    sb.append("-");
                }
            } else {
                sb.append(coeff < 0 ? " - " : " + ");
            }
            if (Math.abs(coeff) != 1) {
                sb.append(Math.abs(coeff)).append("*");
            }
            sb.append(entry.getKey().getName());
            firstTerm = false;
        }

        if (firstTerm) {
            return Long.toString(constant);
        }
        if (constant > 0) {
            sb.append(" + ").append(constant);
        } else if (constant < 0) {
            sb.append(" - ").append(-constant);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearExpression that = (LinearExpression) o;
        return constant == that.constant && coefficients.equals(that.coefficients);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public ArithExpr<IntSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr<IntSort> result = ctx.mkInt(constant);
        for (Map.Entry<DecisionVariable, Long> entry : coefficients.entrySet()) {
            ArithExpr<IntSort> variableExpr = varManager.getZ3Var(entry.getKey());
            result = ctx.mkAdd(result, ctx.mkMul(ctx.mkInt(entry.getValue()), variableExpr));
        }
        return result;
    }
}
