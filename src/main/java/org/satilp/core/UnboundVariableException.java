package org.satilp.core;

import lombok.Getter;

/**
 * 求值时赋值中缺少公式引用的变量。
 */
@Getter
public class UnboundVariableException extends IllegalArgumentException {

    private final String variableName;

    public UnboundVariableException(String variableName) {
        super("变量 '" + variableName + "' 不存在于当前赋值中。");
        this.variableName = variableName;
    }
}
