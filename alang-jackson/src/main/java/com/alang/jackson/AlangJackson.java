package com.alang.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMappers configured for A-language ASTs.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = AlangJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * Program program = mapper.readValue(json, Program.class);
 * </pre>
 */
public final class AlangJackson {

    private AlangJackson() {
        // Utility class
    }

    /**
     * Creates a mapper that writes source spans.
     */
    public static ObjectMapper createObjectMapper() {
        return createObjectMapper(true);
    }

    /**
     * Creates a new ObjectMapper for AST serialization/deserialization.
     *
     * The returned mapper:
     * - Writes the node variant as the "kind" property and resolves it on read
     * - Leaves out null values, except optional children (VarDecl.init, ReturnStmt.value)
     * - Writes "span" on every node only if {@code includeSpans} is set
     * - Reads a missing or null "span" as Span.NONE
     *
     * @param includeSpans whether node spans are written
     */
    public static ObjectMapper createObjectMapper(boolean includeSpans) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Optional children are forced back in through mixins in AstModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule(includeSpans));

        return mapper;
    }
}
