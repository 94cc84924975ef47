package org.satilp.symbolic;

import lombok.Getter;
import org.satilp.expressions.linear.DecisionVariable;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * ILP 后端对一个约束系统的求解结果。
 * FEASIBLE 时携带每个决策变量的取值；UNKNOWN 时携带原因 (例如超时)。
 */
@Getter
public final class IlpResult {

    public enum Status {
        FEASIBLE,
        INFEASIBLE,
        UNKNOWN
    }

    private final Status status;

    private final SortedMap<DecisionVariable, Long> values;

    private final String reason;

    private IlpResult(Status status, Map<DecisionVariable, Long> values, String reason) {
        this.status = status;
        this.values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
        this.reason = reason;
    }

    public static IlpResult feasible(Map<DecisionVariable, Long> values) {
        return new IlpResult(Status.FEASIBLE, Objects.requireNonNull(values, "Values cannot be null"), null);
    }

    public static IlpResult infeasible() {
        return new IlpResult(Status.INFEASIBLE, Collections.emptyMap(), null);
    }

    public static IlpResult unknown(String reason) {
        return new IlpResult(Status.UNKNOWN, Collections.emptyMap(), reason);
    }

    public boolean isFeasible() {
        return status == Status.FEASIBLE;
    }

    public Optional<Long> getValue(DecisionVariable variable) {
        return Optional.ofNullable(values.get(variable));
    }

    @Override
    public String toString() {
        return switch (status) {
            case FEASIBLE -> "FEASIBLE" + values;
            case INFEASIBLE -> "INFEASIBLE";
            case UNKNOWN -> "UNKNOWN(" + reason + ")";
        };
    }
}
