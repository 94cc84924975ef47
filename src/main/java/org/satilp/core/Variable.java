package org.satilp.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 命题变量的引用，即公式树的叶子。
 * 变量名是不透明的字符串，作为 {@link Assignment} 的键使用。
 * 此类是不可变的。
 */
@Getter
public final class Variable implements Operand {

    private static final Logger logger = LoggerFactory.getLogger(Variable.class);

    private final String name;

    private Variable(String name) {
        this.name = name;
        logger.debug("创建了一个Variable: {}", name);
    }

    /**
     * 工厂方法：创建变量引用。
     * @param name 变量名，不能为 null 或空白。
     * @return Variable 实例。
     * @throws MalformedFormulaException 如果变量名为 null 或空白。
     */
    public static Variable of(String name) {
        if (name == null || name.isBlank()) {
            logger.error("Variable.of: 变量名不能为空: '{}'", name);
            throw new MalformedFormulaException("变量名不能为空");
        }
        return new Variable(name);
    }

    @Override
    public boolean isLeafValue() {
        return true;
    }

    @Override
    public boolean isSubformula() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Variable variable = (Variable) o;
        return name.equals(variable.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
