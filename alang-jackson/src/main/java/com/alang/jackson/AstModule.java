package com.alang.jackson;

import com.alang.ast.*;
import com.alang.jackson.mixins.NodeMixin;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module for the AST records.
 *
 * This module handles:
 * - Polymorphic node types via NodeMixin
 * - Serialization of optional children even when they are null
 * - Leaving out "span" when spans are not wanted
 * - Reading spans, with a missing span read as Span.NONE
 */
public class AstModule extends SimpleModule {

    private static final String SPAN_PROPERTY = "span";

    private final boolean includeSpans;

    public AstModule() {
        this(true);
    }

    public AstModule(boolean includeSpans) {
        super("AstModule", new Version(1, 0, 0, null, "com.alang", "alang-jackson"));
        this.includeSpans = includeSpans;
        addDeserializer(Span.class, new SpanDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Declaration.class, NodeMixin.class);
        context.setMixInAnnotations(Type.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(Location.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);

        context.setMixInAnnotations(VarDecl.class, VarDeclMixin.class);
        context.setMixInAnnotations(ReturnStmt.class, ReturnStmtMixin.class);
        context.setMixInAnnotations(Span.class, SpanMixin.class);

        if (!includeSpans) {
            context.addBeanSerializerModifier(new SpanRemovingModifier());
        }
    }

    // ==================== Serialization Mixins ====================

    // VarDecl - init is written even when there is no initializer
    private abstract static class VarDeclMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression init();
    }

    // ReturnStmt - value is written even for a bare return
    private abstract static class ReturnStmtMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression value();
    }

    // isEmpty() would otherwise show up as an "empty" property
    @JsonIgnoreProperties({"empty"})
    private abstract static class SpanMixin {
    }

    // ==================== Serializer Modifier ====================

    private static class SpanRemovingModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            if (!Node.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }
            List<BeanPropertyWriter> filtered = new ArrayList<>(beanProperties.size());
            for (BeanPropertyWriter prop : beanProperties) {
                if (!SPAN_PROPERTY.equals(prop.getName())) {
                    filtered.add(prop);
                }
            }
            return filtered;
        }
    }

    // ==================== Span Deserializer ====================

    static class SpanDeserializer extends StdDeserializer<Span> {

        SpanDeserializer() {
            super(Span.class);
        }

        @Override
        public Span deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            if (!node.isObject()) {
                return ctxt.reportInputMismatch(this, "Expected a span object but found %s", node.getNodeType());
            }
            return new Span(
                node.path("start").asInt(),
                node.path("end").asInt(),
                node.path("startLine").asInt(),
                node.path("startCol").asInt(),
                node.path("endLine").asInt(),
                node.path("endCol").asInt());
        }

        @Override
        public Span getNullValue(DeserializationContext ctxt) {
            return Span.NONE;
        }

        @Override
        public Object getAbsentValue(DeserializationContext ctxt) {
            return Span.NONE;
        }
    }
}
