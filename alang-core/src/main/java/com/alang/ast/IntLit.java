package com.alang.ast;

public record IntLit(
    Span span,
    int value
) implements Expression {
}
