package com.alang.ast;

import java.util.Objects;

public record CallStmt(
    Span span,
    CallExp call
) implements Statement {
    public CallStmt {
        Objects.requireNonNull(call, "call");
    }
}
