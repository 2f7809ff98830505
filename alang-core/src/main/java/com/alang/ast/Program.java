package com.alang.ast;

import java.util.List;

/**
 * Root of the tree: the global declarations in program order.
 */
public record Program(
    Span span,
    List<Declaration> globals
) implements Node {
    public Program {
        globals = List.copyOf(globals);
    }
}
