package com.alang.ast;

import java.util.Objects;

public record VarDecl(
    Span span,
    Id name,
    Type type,
    Expression init  // Can be null
) implements Declaration, Statement {
    public VarDecl {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public VarDecl(Span span, Id name, Type type) {
        this(span, name, type, null);
    }
}
