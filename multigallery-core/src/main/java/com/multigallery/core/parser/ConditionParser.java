package com.multigallery.core.parser;

import com.multigallery.core.ast.Condition;
import com.multigallery.core.ast.ConditionOperator;
import com.multigallery.core.ast.ConditionParameter;
import com.multigallery.core.site.SiteDescriptor;
import com.multigallery.core.site.SiteRegistry;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the attribute of an {@code [if=...]} tag.
 *
 * <p>Accepted forms, with optional whitespace around operators and operands:
 * <pre>
 * site == fa
 * site != eka
 * site in eka,fa,weasyl
 * define == nsfw
 * define in preview,teaser
 * </pre>
 * Site operands are resolved to canonical ids through the registry; define operands must
 * be valid flag names.
 */
final class ConditionParser {

    private static final Pattern CONDITION_PATTERN =
        Pattern.compile("^\\s*([A-Za-z]+)\\s*(==|!=|\\s(?i:in)\\s)\\s*(.*?)\\s*$");

    /** Same rule as command-line flag names. */
    static final Pattern FLAG_PATTERN = Pattern.compile("[a-zA-Z0-9_-]+");

    private final SiteRegistry registry;

    ConditionParser(SiteRegistry registry) {
        this.registry = registry;
    }

    /**
     * Parses a condition expression.
     *
     * @param expression attribute text of the {@code [if]} tag
     * @return parsed condition
     * @throws IllegalArgumentException with a human-readable reason if the expression is invalid
     */
    Condition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("[if] requires a condition, e.g. [if=site==fa]");
        }
        Matcher matcher = CONDITION_PATTERN.matcher(expression);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid [if] condition '" + expression
                + "'; expected <site|define> <==|!=|in> <value>");
        }

        ConditionParameter parameter = parseParameter(matcher.group(1));
        ConditionOperator operator = parseOperator(matcher.group(2).trim());
        String operandText = matcher.group(3);

        Set<String> operands = new LinkedHashSet<>();
        if (operator == ConditionOperator.IN) {
            for (String operand : operandText.split(",", -1)) {
                operands.add(resolveOperand(parameter, operand.trim(), expression));
            }
        } else {
            if (operandText.contains(",")) {
                throw new IllegalArgumentException("Operator " + operator.symbol()
                    + " takes a single value; use 'in' for lists: '" + expression + "'");
            }
            operands.add(resolveOperand(parameter, operandText.trim(), expression));
        }
        return new Condition(parameter, operator, operands);
    }

    private ConditionParameter parseParameter(String keyword) {
        String normalized = keyword.toLowerCase(Locale.ROOT);
        for (ConditionParameter parameter : ConditionParameter.values()) {
            if (parameter.keyword().equals(normalized)) {
                return parameter;
            }
        }
        throw new IllegalArgumentException("Unknown [if] parameter '" + keyword + "'; expected site or define");
    }

    private ConditionOperator parseOperator(String symbol) {
        String normalized = symbol.toLowerCase(Locale.ROOT);
        for (ConditionOperator operator : ConditionOperator.values()) {
            if (operator.symbol().equals(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown [if] operator '" + symbol + "'");
    }

    private String resolveOperand(ConditionParameter parameter, String operand, String expression) {
        if (operand.isEmpty()) {
            throw new IllegalArgumentException("Empty value in [if] condition '" + expression + "'");
        }
        return switch (parameter) {
            case SITE -> registry.find(operand)
                .map(SiteDescriptor::id)
                .orElseThrow(() -> new IllegalArgumentException(
                    "Unknown site '" + operand + "' in [if] condition"));
            case DEFINE -> {
                if (!FLAG_PATTERN.matcher(operand).matches()) {
                    throw new IllegalArgumentException("Invalid define option '" + operand
                        + "'; only letters, digits, dashes and underscores are allowed");
                }
                yield operand;
            }
        };
    }
}
