package com.alang;

import com.alang.ast.Span;

/**
 * Thrown when the source text cannot be split into tokens.
 */
public class LexerException extends RuntimeException {
    private final Span span;

    public LexerException(String message, Span span) {
        super("lexical error at " + span.display() + ": " + message);
        this.span = span;
    }

    public Span getSpan() {
        return span;
    }
}
