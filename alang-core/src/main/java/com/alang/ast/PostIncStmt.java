package com.alang.ast;

import java.util.Objects;

public record PostIncStmt(
    Span span,
    Location loc
) implements Statement {
    public PostIncStmt {
        Objects.requireNonNull(loc, "loc");
    }
}
