package org.satilp.symbolic;

import lombok.Getter;
import org.satilp.core.Assignment;
import org.satilp.core.Formula;
import org.satilp.encoding.ConstraintEncoder;
import org.satilp.evaluation.FormulaEvaluator;
import org.satilp.expressions.linear.ConstraintSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 编码、求解、解码一步完成：formula -> ConstraintSystem -> IlpBackend -> Assignment。
 */
@Getter
public class SatIlpSolver {

    private static final Logger logger = LoggerFactory.getLogger(SatIlpSolver.class);

    private final ConstraintEncoder encoder;
    private final AssignmentSolver assignmentSolver;
    private final SolverOptions options;

    public SatIlpSolver(IlpBackend backend) {
        this(backend, SolverOptions.defaults());
    }

    public SatIlpSolver(IlpBackend backend, SolverOptions options) {
        this(new ConstraintEncoder(), new AssignmentSolver(backend), options);
    }

    public SatIlpSolver(ConstraintEncoder encoder, AssignmentSolver assignmentSolver, SolverOptions options) {
        this.encoder = Objects.requireNonNull(encoder, "ConstraintEncoder cannot be null");
        this.assignmentSolver = Objects.requireNonNull(assignmentSolver, "AssignmentSolver cannot be null");
        this.options = Objects.requireNonNull(options, "SolverOptions cannot be null");
    }

    /**
     * 求公式的一个满足赋值。
     * @param formula 公式。
     * @return 满足公式的赋值 (只包含公式中的变量)。
     * @throws UnsatisfiableException 如果公式不可满足。
     * @throws SolverFailedException 如果开启了验证且解码的赋值不满足公式。
     */
    public Assignment solve(Formula formula) throws UnsatisfiableException {
        ConstraintSystem system = encoder.encodeSystem(formula);
        logger.debug("公式 {} 的约束系统:\n{}", formula, system);
        Assignment assignment = assignmentSolver.solve(system);
        if (options.isVerifyResult() && !FormulaEvaluator.satisfies(formula, assignment)) {
            logger.error("求解器返回的赋值 {} 不满足公式 {}", assignment, formula);
            throw new SolverFailedException("求解器返回的赋值 " + assignment + " 不满足公式 " + formula);
        }
        return assignment;
    }

    /**
     * @return 公式可满足时返回 true。
     */
    public boolean isSatisfiable(Formula formula) {
        try {
            solve(formula);
            return true;
        } catch (UnsatisfiableException e) {
            logger.debug("公式 {} 不可满足", formula);
            return false;
        }
    }
}
