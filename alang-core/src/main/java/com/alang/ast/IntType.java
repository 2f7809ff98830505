package com.alang.ast;

public record IntType(Span span) implements Type {
}
