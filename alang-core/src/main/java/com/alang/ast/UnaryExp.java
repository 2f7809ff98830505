package com.alang.ast;

import java.util.Objects;

public record UnaryExp(
    Span span,
    UnaryOp op,
    Expression operand
) implements Expression {
    public UnaryExp {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(operand, "operand");
    }
}
