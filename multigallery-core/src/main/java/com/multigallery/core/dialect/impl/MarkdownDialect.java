package com.multigallery.core.dialect.impl;

import com.multigallery.core.ast.FormatKind;
import com.multigallery.core.dialect.AbstractMarkupDialect;

import java.util.Optional;

/**
 * Markdown markup. Underline has no Markdown syntax and uses inline HTML instead.
 */
public class MarkdownDialect extends AbstractMarkupDialect {

    private static final String BOLD = "**";
    private static final String ITALIC = "*";
    private static final String UNDERLINE_OPEN = "<u>";
    private static final String UNDERLINE_CLOSE = "</u>";

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown";
    }

    @Override
    public Optional<String> format(FormatKind kind, String content) {
        if (content.isBlank()) {
            return Optional.of("");
        }
        return Optional.of(switch (kind) {
            case BOLD -> BOLD + content + BOLD;
            case ITALIC -> ITALIC + content + ITALIC;
            case UNDERLINE -> UNDERLINE_OPEN + content + UNDERLINE_CLOSE;
        });
    }

    @Override
    public String link(String url, String display) {
        return "[" + display + "](" + url + ")";
    }
}
