package org.satilp.core;

/**
 * 公式树中的一个操作数：要么是变量引用 ({@link Variable})，要么是子公式 ({@link Formula})。
 * 除这两个类之外不应有其他实现。
 */
public interface Operand {

    /**
     * @return 如果此操作数是一个变量名则返回 true。
     */
    boolean isLeafValue();

    /**
     * @return 如果此操作数是一个嵌套的子公式则返回 true。
     */
    boolean isSubformula();
}
