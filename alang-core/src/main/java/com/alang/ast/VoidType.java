package com.alang.ast;

public record VoidType(Span span) implements Type {
}
