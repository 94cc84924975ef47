package org.satilp.symbolic;

import org.satilp.core.Assignment;
import org.satilp.core.Formula;
import org.satilp.core.Variable;
import org.satilp.encoding.ConstraintEncoder;
import org.satilp.evaluation.FormulaEvaluator;
import org.satilp.expressions.linear.ConstraintSystem;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class Z3IlpBackendTest {

    private Z3IlpBackend backend;
    private SatIlpSolver solver;

    @BeforeAll
    void setUp() {
        backend = new Z3IlpBackend(SolverOptions.defaults().withTimeoutMillis(10_000));
        solver = new SatIlpSolver(backend);
    }

    @AfterAll
    void tearDown() {
        if (backend != null) {
            backend.close();
        }
    }

    @Nested
    @DisplayName("基本公式 (Basic Formulas)")
    class BasicTests {

        @Test
        @DisplayName("OR(a) 的解中 a 为真")
        void testSingleVariable() throws UnsatisfiableException {
            Assignment solution = solver.solve(Formula.or("a"));
            assertTrue(solution.getValue("a"));
        }

        @Test
        @DisplayName("NOT(a) 的解中 a 为假")
        void testNotOperator() throws UnsatisfiableException {
            Assignment solution = solver.solve(Formula.not("a"));
            assertFalse(solution.getValue("a"));
        }

        @Test
        @DisplayName("AND(a, b) 的解中 a 和 b 都为真")
        void testAndOperator() throws UnsatisfiableException {
            Assignment solution = solver.solve(Formula.and("a", "b"));
            assertTrue(solution.getValue("a"));
            assertTrue(solution.getValue("b"));
        }

        @Test
        @DisplayName("OR(a, b) 的解中至少一个为真")
        void testOrOperator() throws UnsatisfiableException {
            Assignment solution = solver.solve(Formula.or("a", "b"));
            assertTrue(solution.asMap().containsValue(true));
            assertEquals(2, solution.size());
        }

        @Test
        @DisplayName("OR(AND(a, b), c) 的解中至少一个为真")
        void testNestedAndOr() throws UnsatisfiableException {
            Assignment solution = solver.solve(Formula.or(Formula.and("a", "b"), Variable.of("c")));
            assertTrue(solution.asMap().containsValue(true));
        }

        @Test
        @DisplayName("NOT(OR(AND(a,b), NOT(c))) 的解：c 为真且 a、b 不同时为真")
        void testComplexNestedExpression() throws UnsatisfiableException {
            Assignment solution = solver.solve(
                    Formula.not(Formula.or(Formula.and("a", "b"), Formula.not("c"))));
            assertFalse(solution.getValue("a") && solution.getValue("b"));
            assertTrue(solution.getValue("c"));
        }
    }

    @Nested
    @DisplayName("可满足性 (Satisfiability)")
    class SatisfiabilityTests {

        @Test
        @DisplayName("AND(a, NOT(a)) 应抛出 UnsatisfiableException")
        void testContradiction_ShouldBeUnsatisfiable() {
            Formula formula = Formula.and(Variable.of("a"), Formula.not("a"));
            assertThrows(UnsatisfiableException.class, () -> solver.solve(formula));
        }

        @Test
        @DisplayName("直接求解约束系统：不可行时后端返回 INFEASIBLE")
        void testBackendReportsInfeasible() {
            ConstraintSystem system = new ConstraintEncoder().encodeSystem(
                    Formula.and(Formula.or("a", "b"), Formula.not("a"), Formula.not("b")));
            assertEquals(IlpResult.Status.INFEASIBLE, backend.solve(system).getStatus());
        }

        @Test
        @DisplayName("Z3 的可行点满足系统的全部约束")
        void testFeasiblePointSatisfiesSystem() {
            ConstraintSystem system = new ConstraintEncoder().encodeSystem(
                    Formula.and(Formula.or("a", "b", "c"), Formula.not("a"), Formula.or(Formula.not("b"), Variable.of("a"))));
            IlpResult result = backend.solve(system);
            assertTrue(result.isFeasible());
            assertTrue(system.isSatisfiedBy(result.getValues()));
        }

        @Test
        @DisplayName("同一个子公式对象出现两次：OR(x, x) 与 x 同解")
        void testSharedSubformula() throws UnsatisfiableException {
            Formula shared = Formula.and("a", "b");
            Formula formula = Formula.or(shared, shared);

            Assignment solution = solver.solve(formula);
            assertTrue(solution.getValue("a"));
            assertTrue(solution.getValue("b"));

            Formula contradiction = Formula.and(shared, Formula.not(shared));
            assertThrows(UnsatisfiableException.class, () -> solver.solve(contradiction));
        }

        @Test
        @DisplayName("同一个后端反复求解结果稳定")
        void testRepeatedSolvesOnOneBackend() throws UnsatisfiableException {
            Formula formula = Formula.and(Formula.not("a"), Formula.or("a", "b"));
            for (int i = 0; i < 20; i++) {
                Assignment solution = solver.solve(formula);
                assertFalse(solution.getValue("a"));
                assertTrue(solution.getValue("b"));
            }
            assertFalse(solver.isSatisfiable(Formula.and(Variable.of("a"), Formula.not("a"))));
        }

        @Test
        @DisplayName("Z3 与穷举后端对可满足性的判断一致，且解满足公式")
        void testAgreesWithExhaustiveBackend() {
            SatIlpSolver reference = new SatIlpSolver(new ExhaustiveIlpBackend());
            List<Formula> formulas = List.of(
                    Formula.or("a", "b"),
                    Formula.and(Formula.or("a", "b"), Formula.not("a"), Formula.not("b")),
                    Formula.not(Formula.and(Formula.and("a", "b"), Formula.and("a", "b"))),
                    Formula.and(Formula.or(Formula.not("a"), Variable.of("b")), Formula.or("a", "c"), Formula.not("c")),
                    Formula.and(Formula.not(Formula.or("a", "b")), Formula.or(Variable.of("b"), Formula.and("a", "c"))),
                    Formula.and("x", "y", "z")
            );
            for (Formula formula : formulas) {
                boolean expected = reference.isSatisfiable(formula);
                assertEquals(expected, solver.isSatisfiable(formula), "satisfiability of " + formula);
                if (expected) {
                    assertDoesNotThrow(() -> {
                        Assignment solution = solver.solve(formula);
                        assertTrue(FormulaEvaluator.evaluate(formula, solution), "solution of " + formula);
                        assertEquals(formula.getVariableNames(), solution.getVariableNames());
                    });
                }
            }
        }
    }
}
