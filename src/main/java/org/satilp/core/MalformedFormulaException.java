package org.satilp.core;

/**
 * 构造不合法的公式时抛出：操作数为空，或 NOT 的操作数个数不为 1。
 */
public class MalformedFormulaException extends IllegalArgumentException {

    public MalformedFormulaException(String message) {
        super(message);
    }
}
