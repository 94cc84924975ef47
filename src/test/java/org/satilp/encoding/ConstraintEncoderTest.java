package org.satilp.encoding;

import org.apache.commons.lang3.tuple.Pair;
import org.satilp.core.Assignment;
import org.satilp.core.Formula;
import org.satilp.core.Variable;
import org.satilp.evaluation.FormulaEvaluator;
import org.satilp.expressions.RelationType;
import org.satilp.expressions.linear.ConstraintSystem;
import org.satilp.expressions.linear.DecisionVariable;
import org.satilp.expressions.linear.LinearConstraint;
import org.satilp.expressions.linear.LinearExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintEncoderTest {

    private final ConstraintEncoder encoder = new ConstraintEncoder();

    @Nested
    @DisplayName("系统结构 (System Structure)")
    class StructureTests {

        @Test
        @DisplayName("同名变量只分配一个决策变量")
        void testVariablesAreMemoized() {
            Formula formula = Formula.and(Formula.or("a", "b"), Formula.not("a"), Variable.of("b"));
            ConstraintSystem system = encoder.encodeSystem(formula);

            assertEquals(List.of("a", "b"), new ArrayList<>(system.getOriginalVariables().keySet()));
            assertEquals(3, system.getAuxiliaryVariableCount());
            assertEquals(5, system.getVariables().size());
        }

        @Test
        @DisplayName("结构相同的不同子公式各有自己的辅助变量")
        void testStructurallyEqualSubformulasGetDistinctAux() {
            Formula left = Formula.and("a", "b");
            Formula right = Formula.and("a", "b");
            Formula formula = Formula.not(Formula.and(left, right));
            ConstraintSystem system = encoder.encodeSystem(formula);

            DecisionVariable leftAux = system.getAuxiliaryVariable(left).orElseThrow();
            DecisionVariable rightAux = system.getAuxiliaryVariable(right).orElseThrow();
            assertNotEquals(leftAux, rightAux);
            assertEquals(4, system.getAuxiliaryVariableCount());
        }

        @Test
        @DisplayName("同一个子公式对象出现多次时只分配一个辅助变量")
        void testSharedSubformulaIsEncodedOnce() {
            Formula shared = Formula.and("a", "b");
            Formula formula = Formula.or(shared, shared);
            Pair<ConstraintSystem, DecisionVariable> encoded = encoder.encode(formula);
            ConstraintSystem system = encoded.getLeft();

            DecisionVariable sharedAux = system.getAuxiliaryVariable(shared).orElseThrow();
            assertAll(
                    () -> assertEquals(2, system.getAuxiliaryVariableCount()),
                    () -> assertEquals("aux_0", sharedAux.getName()),
                    () -> assertEquals("aux_1", encoded.getRight().getName()),
                    // AND(a, b) 3 条, OR(x, x) 3 条 (两次 aux >= x, 一次 aux <= 2x), root = 1
                    () -> assertEquals(3 + 3 + 1, system.getConstraints().size())
            );
        }

        @Test
        @DisplayName("辅助变量按后序分配，根变量最后且固定为 1")
        void testPostOrderAndRoot() {
            Formula inner = Formula.and("a", "b");
            Formula formula = Formula.not(inner);
            Pair<ConstraintSystem, DecisionVariable> encoded = encoder.encode(formula);
            ConstraintSystem system = encoded.getLeft();
            DecisionVariable root = encoded.getRight();

            assertAll(
                    () -> assertEquals(root, system.getRootVariable()),
                    () -> assertEquals("aux_1", root.getName()),
                    () -> assertEquals("aux_0", system.getAuxiliaryVariable(inner).orElseThrow().getName()),
                    () -> assertEquals(system.getVariables().last(), root),
                    () -> assertEquals(LinearConstraint.equal(LinearExpression.of(root), LinearExpression.of(1)),
                            system.getConstraints().get(system.getConstraints().size() - 1))
            );
        }

        @Test
        @DisplayName("原始变量命名为 x_<name>")
        void testOriginalVariableNaming() {
            ConstraintSystem system = encoder.encodeSystem(Formula.or("a", "b"));
            DecisionVariable xa = system.getOriginalVariable("a").orElseThrow();
            assertEquals("x_a", xa.getName());
            assertEquals(DecisionVariable.Kind.ORIGINAL, xa.getKind());
            assertTrue(system.getOriginalVariable("c").isEmpty());
        }

        @Test
        @DisplayName("AND(a,b) 的约束：aux <= a, aux <= b, aux >= a + b - 1, aux = 1")
        void testAndConstraints() {
            ConstraintSystem system = encoder.encodeSystem(Formula.and("a", "b"));
            LinearExpression a = LinearExpression.of(system.getOriginalVariable("a").orElseThrow());
            LinearExpression b = LinearExpression.of(system.getOriginalVariable("b").orElseThrow());
            LinearExpression aux = LinearExpression.of(system.getRootVariable());

            assertEquals(List.of(
                    LinearConstraint.lessEqual(aux, a),
                    LinearConstraint.lessEqual(aux, b),
                    LinearConstraint.greaterEqual(aux, a.add(b).add(-1)),
                    LinearConstraint.equal(aux, LinearExpression.of(1))
            ), system.getConstraints());
        }

        @Test
        @DisplayName("OR(a,b,c) 的约束：aux >= 每个操作数, aux <= a + b + c")
        void testNaryOrConstraints() {
            ConstraintSystem system = encoder.encodeSystem(Formula.or("a", "b", "c"));
            List<LinearConstraint> constraints = system.getConstraints();
            assertEquals(5, constraints.size());
            assertEquals(3, constraints.stream().filter(c -> c.getRelation() == RelationType.GE).count());
            LinearConstraint upper = constraints.get(3);
            assertEquals(RelationType.LE, upper.getRelation());
            assertEquals(3, upper.getLeftExpr().getCoefficients().values().stream().filter(v -> v == -1L).count());
        }

        @Test
        @DisplayName("连续编码互不影响")
        void testEncoderIsReentrant() {
            Formula formula = Formula.or(Formula.and("a", "b"), Variable.of("c"));
            ConstraintSystem first = encoder.encodeSystem(formula);
            ConstraintSystem second = encoder.encodeSystem(formula);
            assertEquals(first.getConstraints(), second.getConstraints());
            assertEquals(first.getVariables(), second.getVariables());
        }
    }

    @Nested
    @DisplayName("编码的精确性 (Exactness)")
    class ExactnessTests {

        /**
         * 对所有 0/1 取值：系统可行 当且仅当 每个辅助变量等于其子公式的真值，且根为真。
         */
        private void assertExact(Formula formula) {
            ConstraintSystem system = encoder.encodeSystem(formula);
            List<DecisionVariable> variables = new ArrayList<>(system.getVariables());
            int n = variables.size();
            assertTrue(n <= 20, "test formula too large for enumeration");

            for (long bits = 0; bits < (1L << n); bits++) {
                Map<DecisionVariable, Long> values = new HashMap<>();
                for (int i = 0; i < n; i++) {
                    values.put(variables.get(i), (bits >>> i) & 1L);
                }
                Map<String, Boolean> original = new HashMap<>();
                system.getOriginalVariables().forEach((name, v) -> original.put(name, values.get(v) == 1L));
                Assignment assignment = Assignment.of(original);

                boolean consistent = true;
                for (Map.Entry<Formula, DecisionVariable> entry : system.getAuxiliaryVariables().entrySet()) {
                    boolean truth = FormulaEvaluator.evaluate(entry.getKey(), assignment);
                    if ((values.get(entry.getValue()) == 1L) != truth) {
                        consistent = false;
                        break;
                    }
                }
                boolean expected = consistent && FormulaEvaluator.evaluate(formula, assignment);
                assertEquals(expected, system.isSatisfiedBy(values),
                        "formula " + formula + " under " + values);
            }
        }

        @Test
        @DisplayName("NOT/AND/OR 单节点编码精确")
        void testSingleOperatorEncodingsAreExact() {
            assertExact(Formula.not("a"));
            assertExact(Formula.and("a", "b"));
            assertExact(Formula.or("a", "b"));
            assertExact(Formula.and("a"));
            assertExact(Formula.or("a"));
        }

        @Test
        @DisplayName("n 元与重复变量的编码精确")
        void testNaryAndRepeatedVariableEncodingsAreExact() {
            assertExact(Formula.and("a", "b", "c"));
            assertExact(Formula.or("a", "b", "c"));
            assertExact(Formula.and("a", "a"));
            assertExact(Formula.or("a", "a", "b"));
        }

        @Test
        @DisplayName("嵌套公式的编码精确")
        void testNestedEncodingIsExact() {
            assertExact(Formula.not(Formula.or(Formula.and("a", "b"), Formula.not("c"))));
            assertExact(Formula.and(Variable.of("a"), Formula.not("a")));
        }

        @Test
        @DisplayName("共享子公式的编码精确")
        void testSharedSubformulaEncodingIsExact() {
            Formula shared = Formula.or("a", "b");
            assertExact(Formula.or(shared, shared));
            Formula negated = Formula.not("c");
            assertExact(Formula.and(Formula.or(negated, Variable.of("a")), negated));
        }
    }

    @Test
    @DisplayName("toString 输出类似 LP 的格式")
    void testSystemToString() {
        ConstraintSystem system = encoder.encodeSystem(Formula.not("a"));
        String expected = "SAT_to_ILP:\n"
                + "FEASIBILITY\n"
                + "SUBJECT TO\n"
                + "_C1: x_a + aux_0 - 1 = 0\n"
                + "_C2: aux_0 - 1 = 0\n"
                + "BINARIES\n"
                + "x_a\n"
                + "aux_0 (root)\n";
        assertEquals(expected, system.toString());
    }
}
