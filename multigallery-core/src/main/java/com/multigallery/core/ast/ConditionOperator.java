package com.multigallery.core.ast;

/**
 * Comparison operators of {@code [if]} conditions.
 */
public enum ConditionOperator {
    /** {@code ==}, single operand */
    EQ("=="),

    /** {@code !=}, single operand */
    NOT_EQ("!="),

    /** {@code in}, comma-separated operand set */
    IN("in");

    private final String symbol;

    ConditionOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the operator as written in source.
     *
     * @return symbol
     */
    public String symbol() {
        return symbol;
    }
}
