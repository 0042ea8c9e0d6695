package com.multigallery.core.parser;

import org.antlr.v4.runtime.Token;

import java.util.Locale;
import java.util.Objects;

/**
 * A lexed tag split into name and attribute.
 *
 * @param name lowercase tag name
 * @param attribute text after the first {@code =}, trimmed; {@code null} if there is none
 * @param token the lexer token, for positions and error messages
 */
record TagToken(String name, String attribute, Token token) {

    TagToken {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(token, "token must not be null");
    }

    /**
     * Splits an {@code [name]}, {@code [name=attribute]} or {@code [/name]} token.
     *
     * @param token tag token
     * @return split tag
     */
    static TagToken of(Token token) {
        String text = token.getText();
        int start = text.startsWith("[/") ? 2 : 1;
        String body = text.substring(start, text.length() - 1);
        int equals = body.indexOf('=');
        if (equals < 0) {
            return new TagToken(body.toLowerCase(Locale.ROOT), null, token);
        }
        return new TagToken(
            body.substring(0, equals).toLowerCase(Locale.ROOT),
            body.substring(equals + 1).trim(),
            token
        );
    }

    /**
     * Returns the tag as the author wrote it.
     *
     * @return source text of the tag
     */
    String describe() {
        return token.getText();
    }
}
