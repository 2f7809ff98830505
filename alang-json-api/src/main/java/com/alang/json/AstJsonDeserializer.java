package com.alang.json;

import com.alang.ast.Node;
import com.alang.ast.Program;

/**
 * Rebuilds AST nodes from JSON written by an {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * @throws AstJsonException if the document is not a valid program
     */
    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * Reads a node of the given type, e.g. {@code Expression.class} or
     * {@code FnDecl.class}.
     *
     * @throws AstJsonException if the document is not a valid node of that type
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
