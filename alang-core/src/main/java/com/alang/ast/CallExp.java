package com.alang.ast;

import java.util.List;
import java.util.Objects;

public record CallExp(
    Span span,
    Location callee,
    List<Expression> args
) implements Expression {
    public CallExp {
        Objects.requireNonNull(callee, "callee");
        args = List.copyOf(args);
    }
}
