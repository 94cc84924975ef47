package org.satilp.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 代表一个命题逻辑公式节点，形式为 op(o1, o2, ...)，其中每个操作数是变量或子公式。
 * 构造时检查：操作数非空，NOT 只有一个操作数。
 * 此类是不可变的，操作数在构造前就已存在，因此公式树有限且无环。
 * 同一个子公式对象可以在树中出现多次，编码时按节点身份只分配一个辅助变量。
 */
@Getter
public final class Formula implements Operand {

    private static final Logger logger = LoggerFactory.getLogger(Formula.class);

    private final Operator operator;

    private final List<Operand> operands;

    private final int hashCode;

    /**
     * 私有构造函数。
     * @param operator 运算符。
     * @param operands 操作数列表 (将被拷贝)。
     * @throws MalformedFormulaException 如果操作数为空、包含 null，或 NOT 的操作数个数不为 1。
     */
    private Formula(Operator operator, List<? extends Operand> operands) {
        this.operator = Objects.requireNonNull(operator, "Operator cannot be null");
        if (operands == null || operands.isEmpty()) {
            logger.error("Formula-构造函数: {} 的操作数为空", operator);
            throw new MalformedFormulaException(operator + " 至少需要一个操作数");
        }
        if (operands.stream().anyMatch(Objects::isNull)) {
            logger.error("Formula-构造函数: {} 的操作数中包含 null: {}", operator, operands);
            throw new MalformedFormulaException(operator + " 的操作数不能为 null");
        }
        if (!operator.acceptsArity(operands.size())) {
            logger.error("Formula-构造函数: {} 不接受 {} 个操作数", operator, operands.size());
            throw new MalformedFormulaException(operator + " 需要恰好一个操作数，实际为 " + operands.size());
        }
        this.operands = List.copyOf(operands);
        this.hashCode = Objects.hash(this.operator, this.operands);
        logger.debug("创建 Formula: {}", this);
    }

    /**
     * 工厂方法：从操作数列表创建公式。
     * @param operator 运算符。
     * @param operands 操作数列表。
     * @return Formula 实例。
     */
    public static Formula of(Operator operator, List<? extends Operand> operands) {
        return new Formula(operator, operands);
    }

    /**
     * 工厂方法：从可变参数创建公式。
     * @param operator 运算符。
     * @param operands 操作数。
     * @return Formula 实例。
     */
    public static Formula of(Operator operator, Operand... operands) {
        return new Formula(operator, operands == null ? null : Arrays.asList(operands));
    }

    public static Formula and(Operand... operands) {
        return of(Operator.AND, operands);
    }

    public static Formula or(Operand... operands) {
        return of(Operator.OR, operands);
    }

    public static Formula not(Operand operand) {
        return of(Operator.NOT, operand);
    }

    /**
     * 工厂方法：所有操作数都是变量名的 AND 公式，例如 and("a", "b")。
     */
    public static Formula and(String... names) {
        return of(Operator.AND, variables(names));
    }

    public static Formula or(String... names) {
        return of(Operator.OR, variables(names));
    }

    public static Formula not(String name) {
        return of(Operator.NOT, Variable.of(name));
    }

    private static List<Variable> variables(String... names) {
        if (names == null) {
            return null;
        }
        return Arrays.stream(names).map(Variable::of).collect(Collectors.toList());
    }

    @Override
    public boolean isLeafValue() {
        return false;
    }

    @Override
    public boolean isSubformula() {
        return true;
    }

    /**
     * 检查此节点是否是扁平的，即所有操作数都是变量。
     * @return 如果没有嵌套的子公式则返回 true。
     */
    public boolean isFlat() {
        return operands.stream().allMatch(Operand::isLeafValue);
    }

    /**
     * 收集公式中出现的所有变量名 (去重，按首次出现的顺序)。
     * @return 变量名的有序集合。
     */
    public Set<String> getVariableNames() {
        Set<String> names = new LinkedHashSet<>();
        collectVariableNames(this, names);
        return Collections.unmodifiableSet(names);
    }

    private static void collectVariableNames(Formula formula, Set<String> names) {
        for (Operand operand : formula.operands) {
            if (operand instanceof Variable variable) {
                names.add(variable.getName());
            } else {
                collectVariableNames((Formula) operand, names);
            }
        }
    }

    /**
     * @return 公式树的深度，扁平节点的深度为 1。
     */
    public int depth() {
        int maxChildDepth = 0;
        for (Operand operand : operands) {
            if (operand instanceof Formula sub) {
                maxChildDepth = Math.max(maxChildDepth, sub.depth());
            }
        }
        return maxChildDepth + 1;
    }

    /**
     * @return 公式树中内部节点 (Formula) 的数量，包括自身。
     */
    public int size() {
        int count = 1;
        for (Operand operand : operands) {
            if (operand instanceof Formula sub) {
                count += sub.size();
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Formula that = (Formula) o;
        return operator == that.operator && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (operator == Operator.NOT) {
            return operator.getSymbol() + operands.get(0);
        }
        if (operands.size() == 1) {
            return operator.name() + "(" + operands.get(0) + ")";
        }
        return operands.stream()
                .map(Operand::toString)
                .collect(Collectors.joining(" " + operator.getSymbol() + " ", "(", ")"));
    }
}
