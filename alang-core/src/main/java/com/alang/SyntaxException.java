package com.alang;

import com.alang.ast.Span;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Thrown when the token stream does not match the grammar.
 *
 * <p>Carries the offending token, the position reported for the error and the
 * token kinds the parser would have accepted in its place. No partial tree is
 * ever produced.</p>
 */
public class SyntaxException extends RuntimeException {
    private final Token found;
    private final Span span;
    private final Set<TokenType> expected;

    public SyntaxException(Token found, Span span, Set<TokenType> expected) {
        super(buildMessage(found, span, expected));
        this.found = found;
        this.span = span;
        this.expected = expected.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(expected));
    }

    private static String buildMessage(Token found, Span span, Set<TokenType> expected) {
        String message = "syntax error at " + span.display() + ": unexpected " + found.describe();
        if (expected.isEmpty()) {
            return message;
        }
        String kinds = EnumSet.copyOf(expected).stream()
            .map(type -> "'" + type.text() + "'")
            .collect(Collectors.joining(", "));
        return message + ", expected one of " + kinds;
    }

    public Token getFound() {
        return found;
    }

    /**
     * Where the error is reported. For a premature end of input this is the
     * point right after the last token read, not the end of the source.
     */
    public Span getSpan() {
        return span;
    }

    public Set<TokenType> getExpected() {
        return expected;
    }
}
