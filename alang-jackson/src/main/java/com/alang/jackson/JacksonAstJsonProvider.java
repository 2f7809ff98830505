package com.alang.jackson;

import com.alang.ast.Node;
import com.alang.ast.Program;
import com.alang.json.AstJsonDeserializer;
import com.alang.json.AstJsonException;
import com.alang.json.AstJsonProvider;
import com.alang.json.AstJsonSerializer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {
    private static final Logger LOG = LoggerFactory.getLogger(JacksonAstJsonProvider.class);

    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(AlangJackson.createObjectMapper());
    }

    /**
     * Uses {@code mapper} for everything except {@link AstJsonSerializer#serializeWithoutSpans}.
     */
    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.serializer = new JacksonSerializer(mapper, AlangJackson.createObjectMapper(false));
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;
        private final ObjectMapper spanlessMapper;

        JacksonSerializer(ObjectMapper mapper, ObjectMapper spanlessMapper) {
            this.mapper = mapper;
            this.spanlessMapper = spanlessMapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw failure(node, e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw failure(node, e);
            }
        }

        @Override
        public String serializeWithoutSpans(Node node) throws AstJsonException {
            try {
                return spanlessMapper.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw failure(node, e);
            }
        }

        private static AstJsonException failure(Node node, JsonProcessingException e) {
            String kind = node == null ? "null" : node.getClass().getSimpleName();
            LOG.debug("Serialization of {} failed", kind, e);
            return new AstJsonException("Failed to serialize " + kind, e);
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Program deserializeProgram(String json) throws AstJsonException {
            return deserialize(json, Program.class);
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                T node = mapper.readValue(json, type);
                if (node == null) {
                    throw new AstJsonException("Expected a " + type.getSimpleName() + " but the document is null");
                }
                return node;
            } catch (JsonProcessingException | IllegalArgumentException e) {
                LOG.debug("Deserialization of {} failed", type.getSimpleName(), e);
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
