package org.satilp.encoding;

import org.apache.commons.lang3.tuple.Pair;
import org.satilp.core.Formula;
import org.satilp.core.Operand;
import org.satilp.core.Variable;
import org.satilp.expressions.linear.ConstraintSystem;
import org.satilp.expressions.linear.DecisionVariable;
import org.satilp.expressions.linear.LinearConstraint;
import org.satilp.expressions.linear.LinearExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 将命题公式归约为二值决策变量上的线性约束系统 (SAT -> ILP)。
 * <p>
 * 每个不同的变量名对应一个决策变量；每个公式节点对应一个新的辅助变量
 * (同一个节点对象在树中多次出现时只编码一次)，
 * 并通过以下精确的线性约束与其操作数相连：
 * <ul>
 *     <li>NOT(a): aux = 1 - a</li>
 *     <li>OR(v1..vn): aux >= vi, aux <= v1 + ... + vn</li>
 *     <li>AND(v1..vn): aux <= vi, aux >= v1 + ... + vn - (n - 1)</li>
 * </ul>
 * 根节点的辅助变量固定为 1。于是系统的每个可行整数解都对应公式的一个满足赋值，反之亦然。
 * <p>
 * 编码器本身无状态，每次调用 {@link #encode(Formula)} 使用独立的 {@link EncodingSession}。
 */
public final class ConstraintEncoder {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintEncoder.class);

    private final String systemName;

    public ConstraintEncoder() {
        this(ConstraintSystem.DEFAULT_NAME);
    }

    public ConstraintEncoder(String systemName) {
        this.systemName = Objects.requireNonNull(systemName, "System name cannot be null");
    }

    /**
     * 对公式进行编码。
     * @param formula 合法的公式 (构造时已保证)。
     * @return (约束系统, 根辅助变量)。
     */
    public Pair<ConstraintSystem, DecisionVariable> encode(Formula formula) {
        Objects.requireNonNull(formula, "Formula cannot be null");
        EncodingSession session = new EncodingSession(ConstraintSystem.builder(systemName));
        DecisionVariable root = session.encodeFormula(formula);
        ConstraintSystem system = session.builder.fixRoot(root).build();
        logger.info("公式 {} 编码完成: {} 个原始变量, {} 个辅助变量, {} 条约束",
                formula, system.getOriginalVariables().size(), system.getAuxiliaryVariableCount(),
                system.getConstraints().size());
        return Pair.of(system, root);
    }

    /**
     * 对公式进行编码，只返回约束系统 (根变量可通过 {@link ConstraintSystem#getRootVariable()} 获取)。
     */
    public ConstraintSystem encodeSystem(Formula formula) {
        return encode(formula).getLeft();
    }

    /**
     * 一次编码过程的可变状态：变量编号计数器、变量名到决策变量的映射，以及已编码节点到其辅助变量的映射。
     */
    private static final class EncodingSession {

        private final ConstraintSystem.Builder builder;
        private final Map<String, DecisionVariable> variablesByName = new HashMap<>();
        private final Map<Formula, DecisionVariable> encodedFormulas = new IdentityHashMap<>();
        private int nextId = 0;
        private int nextAuxIndex = 0;

        private EncodingSession(ConstraintSystem.Builder builder) {
            this.builder = builder;
        }

        private DecisionVariable encodeOperand(Operand operand) {
            if (operand instanceof Variable variable) {
                return variableFor(variable.getName());
            }
            if (operand instanceof Formula sub) {
                return encodeFormula(sub);
            }
            throw new IllegalStateException("未知的操作数类型: " + operand.getClass().getName());
        }

        /**
         * 同一个变量名在整棵树中只分配一次决策变量。
         */
        private DecisionVariable variableFor(String name) {
            DecisionVariable existing = variablesByName.get(name);
            if (existing != null) {
                return existing;
            }
            DecisionVariable created = DecisionVariable.original(nextId++, name);
            variablesByName.put(name, created);
            builder.addOriginalVariable(created);
            logger.debug("为变量 {} 分配决策变量 {}", name, created);
            return created;
        }

        /**
         * 后序遍历：先编码操作数，再为当前节点分配辅助变量并生成约束。
         * 共享的节点对象直接复用已分配的辅助变量。
         */
        private DecisionVariable encodeFormula(Formula formula) {
            DecisionVariable encoded = encodedFormulas.get(formula);
            if (encoded != null) {
                logger.debug("子公式 {} 已编码，复用辅助变量 {}", formula, encoded);
                return encoded;
            }
            List<DecisionVariable> operandVars = new ArrayList<>(formula.getOperands().size());
            for (Operand operand : formula.getOperands()) {
                operandVars.add(encodeOperand(operand));
            }

            DecisionVariable aux = DecisionVariable.auxiliary(nextId++, nextAuxIndex++);
            builder.addAuxiliaryVariable(formula, aux);
            encodedFormulas.put(formula, aux);
            LinearExpression auxExpr = LinearExpression.of(aux);

            switch (formula.getOperator()) {
                case NOT -> builder.addConstraint(LinearConstraint.equal(
                        auxExpr, LinearExpression.of(1).subtract(LinearExpression.of(operandVars.get(0)))));
                case OR -> {
                    for (DecisionVariable v : operandVars) {
                        builder.addConstraint(LinearConstraint.greaterEqual(auxExpr, LinearExpression.of(v)));
                    }
                    builder.addConstraint(LinearConstraint.lessEqual(auxExpr, LinearExpression.sum(operandVars)));
                }
                case AND -> {
                    for (DecisionVariable v : operandVars) {
                        builder.addConstraint(LinearConstraint.lessEqual(auxExpr, LinearExpression.of(v)));
                    }
                    builder.addConstraint(LinearConstraint.greaterEqual(auxExpr,
                            LinearExpression.sum(operandVars).add(-(operandVars.size() - 1L))));
                }
            }
            logger.debug("子公式 {} 对应辅助变量 {}", formula, aux);
            return aux;
        }
    }
}
