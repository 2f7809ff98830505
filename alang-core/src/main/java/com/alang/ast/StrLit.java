package com.alang.ast;

import java.util.Objects;

/**
 * A string literal. {@code text} is the literal as written in the source,
 * surrounding quotes and escape sequences included.
 */
public record StrLit(
    Span span,
    String text
) implements Expression {
    public StrLit {
        Objects.requireNonNull(text, "text");
    }
}
