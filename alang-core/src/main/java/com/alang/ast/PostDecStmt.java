package com.alang.ast;

import java.util.Objects;

public record PostDecStmt(
    Span span,
    Location loc
) implements Statement {
    public PostDecStmt {
        Objects.requireNonNull(loc, "loc");
    }
}
