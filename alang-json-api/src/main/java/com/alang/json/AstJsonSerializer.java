package com.alang.json;

import com.alang.ast.Node;

/**
 * Writes AST nodes as JSON. Every node object carries a {@code "kind"}
 * property naming its variant.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node and its subtree, source spans included.
     *
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)}, indented for reading.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;

    /**
     * Serializes a node without any {@code "span"} properties. Reading the
     * result back gives nodes whose spans are {@link com.alang.ast.Span#NONE}.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializeWithoutSpans(Node node) throws AstJsonException;
}
