package org.satilp.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 变量名到布尔值的赋值。
 * 由调用者提供用于求值，或由求解器解码得到。
 * 此类是不可变的。
 */
public final class Assignment {

    private static final Logger logger = LoggerFactory.getLogger(Assignment.class);

    private static final Assignment EMPTY = new Assignment(Collections.emptyMap());

    private final SortedMap<String, Boolean> values;

    /**
     * 私有构造函数，通过 Map 创建 Assignment。
     * @param values 包含变量名及其值的 Map。
     */
    private Assignment(Map<String, Boolean> values) {
        Map<String, Boolean> checked = new HashMap<>();
        for (Map.Entry<String, Boolean> entry : Objects.requireNonNull(values, "Values map cannot be null").entrySet()) {
            checked.put(Objects.requireNonNull(entry.getKey(), "Variable name cannot be null"),
                    Objects.requireNonNull(entry.getValue(), "Value of '" + entry.getKey() + "' cannot be null"));
        }
        this.values = Collections.unmodifiableSortedMap(new TreeMap<>(checked));
        logger.debug("创建 Assignment: {}", this.values);
    }

    /**
     * 工厂方法：从 Map 创建 Assignment 实例。
     * @param values 变量名到布尔值的映射。
     * @return Assignment 实例。
     */
    public static Assignment of(Map<String, Boolean> values) {
        return new Assignment(values);
    }

    public static Assignment empty() {
        return EMPTY;
    }

    /**
     * 返回一个新的赋值，其中 name 被设为 value (覆盖已有的值)。
     * @param name 变量名。
     * @param value 布尔值。
     * @return 新的 Assignment。
     */
    public Assignment with(String name, boolean value) {
        Map<String, Boolean> newValues = new HashMap<>(this.values);
        newValues.put(name, value);
        return new Assignment(newValues);
    }

    /**
     * 获取指定变量的值。
     * @param name 变量名。
     * @return 变量的布尔值。
     * @throws UnboundVariableException 如果赋值中没有该变量。
     */
    public boolean getValue(String name) {
        Boolean value = values.get(name);
        if (value == null) {
            logger.error("尝试获取不存在的变量值：变量 '{}' 不存在于当前赋值 {} 中。", name, this);
            throw new UnboundVariableException(name);
        }
        return value;
    }

    public boolean isBound(String name) {
        return values.containsKey(name);
    }

    public Set<String> getVariableNames() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public SortedMap<String, Boolean> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Assignment that = (Assignment) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
