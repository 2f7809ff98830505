package com.alang.ast;

import java.util.List;
import java.util.Objects;

public record FnDecl(
    Span span,
    Id name,
    List<FormalDecl> formals,
    Type returnType,
    List<Statement> body
) implements Declaration {
    public FnDecl {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(returnType, "returnType");
        formals = List.copyOf(formals);
        body = List.copyOf(body);
    }
}
