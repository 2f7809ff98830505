package com.alang.ast;

import java.util.Objects;

/**
 * {@code maybe dst means primary otherwise fallback}.
 */
public record MaybeStmt(
    Span span,
    Location dst,
    Expression primary,
    Expression fallback
) implements Statement {
    public MaybeStmt {
        Objects.requireNonNull(dst, "dst");
        Objects.requireNonNull(primary, "primary");
        Objects.requireNonNull(fallback, "fallback");
    }
}
