package com.alang.ast;

public record BoolLit(
    Span span,
    boolean value
) implements Expression {
}
