package com.alang.ast;

import java.util.List;
import java.util.Objects;

public record IfElseStmt(
    Span span,
    Expression cond,
    List<Statement> trueBody,
    List<Statement> falseBody
) implements Statement {
    public IfElseStmt {
        Objects.requireNonNull(cond, "cond");
        trueBody = List.copyOf(trueBody);
        falseBody = List.copyOf(falseBody);
    }
}
