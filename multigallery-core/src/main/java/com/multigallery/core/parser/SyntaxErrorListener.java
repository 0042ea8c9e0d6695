package com.multigallery.core.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Turns lexer and parser syntax errors into {@link MarkupParseException}s.
 */
final class SyntaxErrorListener extends BaseErrorListener {

    static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

    private SyntaxErrorListener() {
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        throw new MarkupParseException("Syntax error: " + msg, line, charPositionInLine + 1);
    }
}
