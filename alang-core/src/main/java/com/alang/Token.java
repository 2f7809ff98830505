package com.alang;

import com.alang.ast.Span;

/**
 * A token of the A language.
 *
 * <p>{@code literal} holds the payload of {@link TokenType#ID} (the name),
 * {@link TokenType#INTLITERAL} (an {@link Integer}) and
 * {@link TokenType#STRINGLITERAL} (the literal text, quotes included);
 * it is null for every other kind.</p>
 */
public record Token(
    TokenType type,
    String lexeme,
    Object literal,
    int position,
    int endPosition,
    int line,
    int column,
    int endLine,
    int endColumn
) {
    public Span span() {
        return new Span(position, endPosition, line, column, endLine, endColumn);
    }

    /**
     * Text used for this token in diagnostics.
     */
    public String describe() {
        return switch (type) {
            case END -> type.text();
            case ID, INTLITERAL, STRINGLITERAL -> type.text() + " '" + lexeme + "'";
            default -> "'" + lexeme + "'";
        };
    }
}
