package com.alang.ast;

import com.alang.Unparser;

import java.io.IOException;

/**
 * Base interface for all A-language AST nodes.
 */
public sealed interface Node permits
    Program,
    Declaration,
    Type,
    Expression,
    Statement {

    Span span();

    /**
     * Canonical source text of this node.
     */
    default String unparse() {
        return Unparser.unparse(this);
    }

    /**
     * Writes the canonical source text of this node to {@code out}.
     *
     * @param indent nesting depth, or {@link Unparser#NO_INDENT}
     */
    default void unparse(Appendable out, int indent) throws IOException {
        Unparser.unparse(this, out, indent);
    }
}
