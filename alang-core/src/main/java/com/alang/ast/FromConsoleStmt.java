package com.alang.ast;

import java.util.Objects;

public record FromConsoleStmt(
    Span span,
    Location dst
) implements Statement {
    public FromConsoleStmt {
        Objects.requireNonNull(dst, "dst");
    }
}
