package com.multigallery.core.ast;

/**
 * What an {@code [if]} condition tests.
 */
public enum ConditionParameter {
    /** The site being rendered for; operands are site ids or aliases. */
    SITE("site"),

    /** Flags defined on the command line; operands are opaque strings. */
    DEFINE("define");

    private final String keyword;

    ConditionParameter(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the keyword used in source conditions.
     *
     * @return keyword
     */
    public String keyword() {
        return keyword;
    }
}
