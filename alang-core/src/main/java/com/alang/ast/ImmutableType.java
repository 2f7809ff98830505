package com.alang.ast;

import java.util.Objects;

public record ImmutableType(
    Span span,
    Type inner
) implements Type {
    public ImmutableType {
        Objects.requireNonNull(inner, "inner");
    }
}
