package org.satilp.core;

/**
 * 命题逻辑运算符。
 * NOT 为一元运算符，AND/OR 接受一个或多个操作数。
 */
public enum Operator {

    AND("∧"),
    OR("∨"),
    NOT("¬");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 检查给定的操作数个数对此运算符是否合法。
     * @param operandCount 操作数个数。
     * @return 合法返回 true。
     */
    public boolean acceptsArity(int operandCount) {
        return switch (this) {
            case NOT -> operandCount == 1;
            case AND, OR -> operandCount >= 1;
        };
    }
}
