package com.multigallery.core.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A parsed {@code [if]} condition.
 *
 * <p>Site operands are canonical site ids; the parser resolves aliases before building
 * the condition.
 *
 * @param parameter what is tested
 * @param operator comparison operator
 * @param operands one operand for {@code ==}/{@code !=}, one or more for {@code in}
 */
public record Condition(
    ConditionParameter parameter,
    ConditionOperator operator,
    Set<String> operands
) {
    /**
     * Compact constructor with validation.
     */
    public Condition {
        Objects.requireNonNull(parameter, "parameter must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(operands, "operands must not be null");
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("condition needs at least one operand");
        }
        if (operator != ConditionOperator.IN && operands.size() != 1) {
            throw new IllegalArgumentException(operator.symbol() + " takes exactly one operand");
        }
        operands = Collections.unmodifiableSet(new LinkedHashSet<>(operands));
    }

    /**
     * Shorthand for a single-operand condition.
     *
     * @param parameter what is tested
     * @param operator {@code EQ} or {@code NOT_EQ}
     * @param operand the operand
     * @return condition
     */
    public static Condition of(ConditionParameter parameter, ConditionOperator operator, String operand) {
        return new Condition(parameter, operator, Set.of(operand));
    }
}
