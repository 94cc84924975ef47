package org.satilp.symbolic;

import lombok.Getter;

/**
 * 编码后的约束系统不可行，即原公式不可满足。
 * 这是调用者需要处理的正常结果，而不是系统故障。
 */
@Getter
public class UnsatisfiableException extends Exception {

    private final String systemName;

    public UnsatisfiableException(String systemName) {
        super("约束系统 " + systemName + " 不可行：公式不可满足");
        this.systemName = systemName;
    }
}
