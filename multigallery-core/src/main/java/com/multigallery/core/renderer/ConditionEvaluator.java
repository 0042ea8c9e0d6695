package com.multigallery.core.renderer;

import com.multigallery.core.ast.Condition;

import java.util.Objects;

/**
 * Evaluates {@code [if]} conditions against a render context.
 *
 * <p>Site operands are canonical ids already, so site conditions compare ids directly.
 * Define conditions compare against the defined flags as opaque strings; {@code in} is true
 * when any listed flag is defined.
 */
public class ConditionEvaluator {

    /**
     * Evaluates a condition.
     *
     * @param condition parsed condition
     * @param context render context
     * @return true if the then-branch applies
     */
    public boolean evaluate(Condition condition, RenderContext context) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(context, "context must not be null");

        boolean matches = switch (condition.parameter()) {
            case SITE -> condition.operands().contains(context.site());
            case DEFINE -> condition.operands().stream().anyMatch(context::isDefined);
        };
        return switch (condition.operator()) {
            case EQ, IN -> matches;
            case NOT_EQ -> !matches;
        };
    }
}
