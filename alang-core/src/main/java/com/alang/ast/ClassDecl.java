package com.alang.ast;

import java.util.List;
import java.util.Objects;

/**
 * A {@code custom} type declaration and its members.
 */
public record ClassDecl(
    Span span,
    Id name,
    List<Declaration> members
) implements Declaration {
    public ClassDecl {
        Objects.requireNonNull(name, "name");
        members = List.copyOf(members);
    }
}
