package com.multigallery.core.ast;

/**
 * Basic formatting kinds and their source tag names.
 */
public enum FormatKind {
    /** {@code [b]...[/b]} */
    BOLD("b"),

    /** {@code [i]...[/i]} */
    ITALIC("i"),

    /** {@code [u]...[/u]} */
    UNDERLINE("u");

    private final String tagName;

    FormatKind(String tagName) {
        this.tagName = tagName;
    }

    /**
     * Returns the source tag name.
     *
     * @return tag name without brackets
     */
    public String tagName() {
        return tagName;
    }
}
