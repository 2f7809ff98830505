package com.alang.ast;

import java.util.Objects;

public record BinaryExp(
    Span span,
    BinaryOp op,
    Expression left,
    Expression right
) implements Expression {
    public BinaryExp {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
