package com.alang.ast;

public record BoolType(Span span) implements Type {
}
