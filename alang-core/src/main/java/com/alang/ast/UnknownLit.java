package com.alang.ast;

/**
 * The {@code eh?} literal.
 */
public record UnknownLit(Span span) implements Expression {
}
