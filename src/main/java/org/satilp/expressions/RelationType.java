package org.satilp.expressions;

/**
 * 线性约束中的关系类型，约束统一规范化为 E ~ 0 的形式。
 */
public enum RelationType {

    LE("<="),   // Less Equal
    GE(">="),   // Greater Equal
    EQ("=");    // Equal

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 判断 value ~ 0 是否成立。
     * @param value 规范化后左侧表达式的值。
     * @return 成立返回 true。
     */
    public boolean holds(long value) {
        return switch (this) {
            case LE -> value <= 0;
            case GE -> value >= 0;
            case EQ -> value == 0;
        };
    }
}
