package com.alang.ast;

import java.util.Objects;

public record AssignStmt(
    Span span,
    Location dst,
    Expression src
) implements Statement {
    public AssignStmt {
        Objects.requireNonNull(dst, "dst");
        Objects.requireNonNull(src, "src");
    }
}
