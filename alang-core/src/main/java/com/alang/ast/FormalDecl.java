package com.alang.ast;

import java.util.Objects;

/**
 * A function parameter. Unlike {@link VarDecl} it never has an initializer.
 */
public record FormalDecl(
    Span span,
    Id name,
    Type type
) implements Declaration {
    public FormalDecl {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }
}
