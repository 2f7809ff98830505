package com.alang.ast;

import java.util.Objects;

public record RefType(
    Span span,
    Type inner
) implements Type {
    public RefType {
        Objects.requireNonNull(inner, "inner");
    }
}
