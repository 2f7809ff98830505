package com.alang.ast;

import java.util.Objects;

public record ToConsoleStmt(
    Span span,
    Expression src
) implements Statement {
    public ToConsoleStmt {
        Objects.requireNonNull(src, "src");
    }
}
