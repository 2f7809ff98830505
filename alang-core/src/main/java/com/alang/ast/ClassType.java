package com.alang.ast;

import java.util.Objects;

/**
 * Reference to a {@code custom} type by name.
 */
public record ClassType(
    Span span,
    Id name
) implements Type {
    public ClassType {
        Objects.requireNonNull(name, "name");
    }
}
