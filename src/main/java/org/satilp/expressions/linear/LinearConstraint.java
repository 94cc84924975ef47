package org.satilp.expressions.linear;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import lombok.Getter;
import org.satilp.expressions.RelationType;
import org.satilp.expressions.ToZ3BoolExpr;
import org.satilp.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * 代表一个线性约束，形式为 E1 ~ E2，其中 E1 和 E2 都是决策变量上的线性表达式。
 * 内部规范化为 E_normalized ~ 0 的形式。
 * 此类是不可变的。
 */
@Getter
public final class LinearConstraint implements ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(LinearConstraint.class);

    // 规范化后的形式：leftExpr ~ 0
    private final LinearExpression leftExpr; // E1 - E2
    private final RelationType relation;

    private final int hashCode;

    /**
     * 私有构造函数，用于创建 LinearConstraint 实例。
     * 内部会进行规范化：将 E1 ~ E2 转换为 (E1 - E2) ~ 0。
     *
     * @param left     原始左侧表达式。
     * @param right    原始右侧表达式。
     * @param relation 原始关系类型。
     * @throws NullPointerException 如果任何参数为 null。
     */
    private LinearConstraint(LinearExpression left, LinearExpression right, RelationType relation) {
        Objects.requireNonNull(left, "LinearConstraint-构造函数: left 表达式不能为 null");
        Objects.requireNonNull(right, "LinearConstraint-构造函数: right 表达式不能为 null");
        Objects.requireNonNull(relation, "LinearConstraint-构造函数: relation 不能为 null");

        this.leftExpr = left.subtract(right);
        this.relation = relation;

        // 常数约束：不含变量时可以直接判断真假
        if (this.leftExpr.isConstant()) {
            if (relation.holds(this.leftExpr.getConstant())) {
                logger.info("LinearConstraint-构造函数: 创建了一个恒真约束: {}", this);
            } else {
                logger.warn("LinearConstraint-构造函数: 创建了一个恒假约束: {}", this);
            }
        }
        this.hashCode = Objects.hash(this.leftExpr, this.relation);
        logger.debug("创建 LinearConstraint: {}", this);
    }

    /**
     * left <= right
     */
    public static LinearConstraint lessEqual(LinearExpression left, LinearExpression right) {
        return new LinearConstraint(left, right, RelationType.LE);
    }

    /**
     * left >= right
     */
    public static LinearConstraint greaterEqual(LinearExpression left, LinearExpression right) {
        return new LinearConstraint(left, right, RelationType.GE);
    }

    /**
     * left = right
     */
    public static LinearConstraint equal(LinearExpression left, LinearExpression right) {
        return new LinearConstraint(left, right, RelationType.EQ);
    }

    /**
     * 检查给定的变量取值是否满足此约束。
     * @param values 决策变量的取值。
     * @return 满足返回 true。
     */
    public boolean isSatisfiedBy(Map<DecisionVariable, Long> values) {
        return relation.holds(leftExpr.evaluate(values));
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr<IntSort> z3LeftExpr = leftExpr.toZ3ArithExpr(ctx, varManager);
        ArithExpr<IntSort> z3Zero = ctx.mkInt(0);

        return switch (relation) {
            case LE -> ctx.mkLe(z3LeftExpr, z3Zero);
            case GE -> ctx.mkGe(z3LeftExpr, z3Zero);
            case EQ -> ctx.mkEq(z3LeftExpr, z3Zero);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearConstraint that = (LinearConstraint) o;
        return relation == that.relation && leftExpr.equals(that.leftExpr);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return leftExpr.toString() + " " + relation.getSymbol() + " 0";
    }
}
