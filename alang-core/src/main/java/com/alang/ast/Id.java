package com.alang.ast;

public record Id(
    Span span,
    String name
) implements Location {
}
