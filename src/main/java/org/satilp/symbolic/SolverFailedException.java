package org.satilp.symbolic;

/**
 * 求解器未能给出可用的结果：返回 UNKNOWN、取值不是 0/1，或解码后的赋值未通过验证。
 */
public class SolverFailedException extends RuntimeException {

    public SolverFailedException(String message) {
        super(message);
    }
}
