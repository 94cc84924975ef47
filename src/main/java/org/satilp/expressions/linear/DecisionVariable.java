package org.satilp.expressions.linear;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 约束系统中的二值决策变量，取值范围为 {0, 1}。
 * 原始变量对应公式中的一个变量名 (命名为 "x_" + 变量名)，
 * 辅助变量对应一个子公式的真值 (命名为 "aux_" + 序号)。
 * id 只在同一个约束系统内唯一，由编码器按分配顺序给出。
 */
@Getter
public final class DecisionVariable implements Comparable<DecisionVariable> {

    private static final Logger logger = LoggerFactory.getLogger(DecisionVariable.class);

    public enum Kind {
        ORIGINAL,
        AUXILIARY
    }

    private final int id;
    private final String name;
    private final Kind kind;
    // 仅对 ORIGINAL 有意义
    private final String formulaVariableName;

    private final int hashCode;

    private DecisionVariable(int id, String name, Kind kind, String formulaVariableName) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "Decision variable name cannot be null");
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.formulaVariableName = formulaVariableName;
        this.hashCode = Objects.hash(id, name);
        logger.debug("创建了一个DecisionVariable: {} with id {}", name, id);
    }

    /**
     * 创建公式变量对应的决策变量。
     * @param id 系统内的唯一编号。
     * @param formulaVariableName 公式中的变量名。
     * @return 新的 DecisionVariable。
     */
    public static DecisionVariable original(int id, String formulaVariableName) {
        Objects.requireNonNull(formulaVariableName, "Formula variable name cannot be null");
        return new DecisionVariable(id, "x_" + formulaVariableName, Kind.ORIGINAL, formulaVariableName);
    }

    /**
     * 创建子公式对应的辅助变量。
     * @param id 系统内的唯一编号。
     * @param auxIndex 辅助变量序号。
     * @return 新的 DecisionVariable。
     */
    public static DecisionVariable auxiliary(int id, int auxIndex) {
        return new DecisionVariable(id, "aux_" + auxIndex, Kind.AUXILIARY, null);
    }

    public boolean isAuxiliary() {
        return kind == Kind.AUXILIARY;
    }

    @Override
    public int compareTo(DecisionVariable o) {
        return Integer.compare(this.id, o.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DecisionVariable that = (DecisionVariable) o;
        return id == that.id && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name;
    }
}
