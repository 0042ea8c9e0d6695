package com.multigallery.core.parser;

import org.antlr.v4.runtime.Token;

/**
 * Thrown when a description cannot be parsed.
 *
 * <p>Parsing stops at the first error; no partial tree is produced. The message reads
 * {@code "<reason> at line L, column C"} with 1-based positions of the offending tag.
 */
public class MarkupParseException extends RuntimeException {

    private final String reason;
    private final int line;
    private final int column;

    /**
     * Creates an exception for a reason at a position.
     *
     * @param reason human-readable reason
     * @param line 1-based line
     * @param column 1-based column
     */
    public MarkupParseException(String reason, int line, int column) {
        super(reason + " at line " + line + ", column " + column);
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    /**
     * Creates an exception positioned at a token.
     *
     * @param token offending token
     * @param reason human-readable reason
     * @return exception with the token's line and 1-based column
     */
    public static MarkupParseException at(Token token, String reason) {
        return new MarkupParseException(reason, token.getLine(), token.getCharPositionInLine() + 1);
    }

    public String reason() {
        return reason;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
