package com.multigallery.core.dialect.impl;

import com.multigallery.core.ast.FormatKind;
import com.multigallery.core.dialect.AbstractMarkupDialect;

import java.util.Optional;

/**
 * BBCode markup shared by the forum-style galleries.
 *
 * <p>Formatting tags around blank content are dropped entirely, so {@code [b] [/b]} in the
 * source does not leave empty tags behind in the output.
 */
public class BbcodeDialect extends AbstractMarkupDialect {

    @Override
    public String getId() {
        return "bbcode";
    }

    @Override
    public String getDisplayName() {
        return "BBCode";
    }

    @Override
    public Optional<String> format(FormatKind kind, String content) {
        if (content.isBlank()) {
            return Optional.of("");
        }
        String tag = switch (kind) {
            case BOLD -> "b";
            case ITALIC -> "i";
            case UNDERLINE -> "u";
        };
        return Optional.of("[" + tag + "]" + content + "[/" + tag + "]");
    }

    @Override
    public String link(String url, String display) {
        return "[url=" + url + "]" + display + "[/url]";
    }
}
