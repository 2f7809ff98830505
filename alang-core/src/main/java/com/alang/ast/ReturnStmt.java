package com.alang.ast;

public record ReturnStmt(
    Span span,
    Expression value  // Can be null
) implements Statement {
}
