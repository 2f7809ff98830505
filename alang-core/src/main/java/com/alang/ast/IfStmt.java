package com.alang.ast;

import java.util.List;
import java.util.Objects;

public record IfStmt(
    Span span,
    Expression cond,
    List<Statement> body
) implements Statement {
    public IfStmt {
        Objects.requireNonNull(cond, "cond");
        body = List.copyOf(body);
    }
}
