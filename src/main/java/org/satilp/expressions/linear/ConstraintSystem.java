package org.satilp.expressions.linear;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.satilp.core.Formula;
import org.satilp.expressions.ToZ3BoolExpr;
import org.satilp.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 二值决策变量上的线性约束系统，语义为所有约束的合取，目标仅为可行性。
 * 除约束外还记录：公式变量名到决策变量的映射、每个子公式节点到其辅助变量的映射，
 * 以及被固定为 1 的根变量。
 * 每次编码构建一个实例，交给求解器使用一次。此类是不可变的。
 */
@Getter
public final class ConstraintSystem implements ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintSystem.class);

    public static final String DEFAULT_NAME = "SAT_to_ILP";

    private final String name;

    // 按生成顺序保存
    private final List<LinearConstraint> constraints;

    private final SortedSet<DecisionVariable> variables;

    /** 公式变量名 -> 决策变量，只包含原始变量 */
    private final Map<String, DecisionVariable> originalVariables;

    /** 子公式节点 -> 辅助变量，按节点身份 (而非结构相等) 区分 */
    private final Map<Formula, DecisionVariable> auxiliaryVariables;

    private final DecisionVariable rootVariable;

    private ConstraintSystem(Builder builder) {
        this.name = builder.name;
        this.constraints = Collections.unmodifiableList(new ArrayList<>(builder.constraints));
        this.variables = Collections.unmodifiableSortedSet(new TreeSet<>(builder.variables));
        this.originalVariables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.originalVariables));
        this.auxiliaryVariables = Collections.unmodifiableMap(new IdentityHashMap<>(builder.auxiliaryVariables));
        this.rootVariable = builder.rootVariable;
        logger.debug("创建 ConstraintSystem {}: {} 个变量, {} 条约束, 根变量 {}",
                name, variables.size(), constraints.size(), rootVariable);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * 获取公式变量对应的决策变量。
     * @param variableName 公式中的变量名。
     * @return 对应的决策变量，不存在时为 empty。
     */
    public Optional<DecisionVariable> getOriginalVariable(String variableName) {
        return Optional.ofNullable(originalVariables.get(variableName));
    }

    /**
     * 获取子公式节点对应的辅助变量。按身份查找，结构相同但不同的节点有各自的辅助变量。
     * @param subformula 子公式节点。
     * @return 对应的辅助变量，不存在时为 empty。
     */
    public Optional<DecisionVariable> getAuxiliaryVariable(Formula subformula) {
        return Optional.ofNullable(auxiliaryVariables.get(subformula));
    }

    public int getAuxiliaryVariableCount() {
        return auxiliaryVariables.size();
    }

    /**
     * 检查给定的取值是否是此系统的可行解：每个变量取 0 或 1，且满足所有约束。
     * @param values 决策变量的取值，必须覆盖全部变量。
     * @return 可行返回 true。
     */
    public boolean isSatisfiedBy(Map<DecisionVariable, Long> values) {
        for (DecisionVariable variable : variables) {
            Long value = values.get(variable);
            if (value == null || (value != 0L && value != 1L)) {
                logger.debug("变量 {} 的取值 {} 不是 0 或 1", variable, value);
                return false;
            }
        }
        for (LinearConstraint constraint : constraints) {
            if (!constraint.isSatisfiedBy(values)) {
                logger.debug("约束 {} 在取值 {} 下不成立", constraint, values);
                return false;
            }
        }
        return true;
    }

    // --- Z3 转换 ---
    // 变量的 {0, 1} 取值范围由 Z3VariableManager.assertBinaryDomains 单独断言
    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        if (constraints.isEmpty()) {
            return ctx.mkTrue();
        }
        BoolExpr[] z3Constraints = constraints.stream()
                .map(c -> c.toZ3BoolExpr(ctx, varManager))
                .toArray(BoolExpr[]::new);
        return ctx.mkAnd(z3Constraints);
    }

    /**
     * 以类似 LP 文件的格式输出，便于诊断。
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(name).append(":\n");
        sb.append("FEASIBILITY\n");
        sb.append("SUBJECT TO\n");
        for (int i = 0; i < constraints.size(); i++) {
            sb.append("_C").append(i + 1).append(": ").append(constraints.get(i)).append('\n');
        }
        sb.append("BINARIES\n");
        for (DecisionVariable variable : variables) {
            sb.append(variable.getName());
            if (variable.equals(rootVariable)) {
                sb.append(" (root)");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * 逐步构建 ConstraintSystem。仅供编码器在一次编码过程中使用，非线程安全。
     */
    public static final class Builder {

        private final String name;
        private final List<LinearConstraint> constraints = new ArrayList<>();
        private final Set<DecisionVariable> variables = new HashSet<>();
        private final Map<String, DecisionVariable> originalVariables = new LinkedHashMap<>();
        private final Map<Formula, DecisionVariable> auxiliaryVariables = new IdentityHashMap<>();
        private DecisionVariable rootVariable;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "System name cannot be null");
        }

        /**
         * 登记公式变量对应的决策变量。
         * @throws IllegalStateException 如果该变量名已登记。
         */
        public Builder addOriginalVariable(DecisionVariable variable) {
            String variableName = Objects.requireNonNull(variable.getFormulaVariableName(),
                    "Only original decision variables can be bound to a formula variable");
            if (originalVariables.putIfAbsent(variableName, variable) != null) {
                throw new IllegalStateException("变量 '" + variableName + "' 已经分配过决策变量");
            }
            variables.add(variable);
            return this;
        }

        /**
         * 登记子公式节点对应的辅助变量。
         * @throws IllegalStateException 如果该节点已登记。
         */
        public Builder addAuxiliaryVariable(Formula subformula, DecisionVariable variable) {
            Objects.requireNonNull(subformula, "Subformula cannot be null");
            if (!variable.isAuxiliary()) {
                throw new IllegalArgumentException("决策变量 " + variable + " 不是辅助变量");
            }
            if (auxiliaryVariables.putIfAbsent(subformula, variable) != null) {
                throw new IllegalStateException("子公式 " + subformula + " 已经分配过辅助变量");
            }
            variables.add(variable);
            return this;
        }

        public Builder addConstraint(LinearConstraint constraint) {
            constraints.add(Objects.requireNonNull(constraint, "Constraint cannot be null"));
            return this;
        }

        /**
         * 指定根变量，并添加 root = 1 的约束。
         */
        public Builder fixRoot(DecisionVariable root) {
            if (!variables.contains(root)) {
                throw new IllegalArgumentException("根变量 " + root + " 未在系统中登记");
            }
            if (rootVariable != null) {
                throw new IllegalStateException("根变量已经被指定为 " + rootVariable);
            }
            this.rootVariable = root;
            constraints.add(LinearConstraint.equal(LinearExpression.of(root), LinearExpression.of(1)));
            return this;
        }

        public ConstraintSystem build() {
            if (rootVariable == null) {
                throw new IllegalStateException("构建 ConstraintSystem 前必须指定根变量");
            }
            return new ConstraintSystem(this);
        }
    }
}
