package com.alang.ast;

import java.util.List;
import java.util.Objects;

public record WhileStmt(
    Span span,
    Expression cond,
    List<Statement> body
) implements Statement {
    public WhileStmt {
        Objects.requireNonNull(cond, "cond");
        body = List.copyOf(body);
    }
}
