package com.jsunparser.jackson;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.annotation.JsonTypeIdResolver;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.jsontype.TypeSerializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.jsunparser.ast.*;

import java.io.IOException;

/**
 * Jackson module that configures serialization/deserialization for the node records.
 *
 * This module handles:
 * - Polymorphic type handling through the "type" member, via NodeMixin
 * - Reading kinds the tree model does not know as UnknownNode
 * - Writing UnknownNode back as the JSON it was read from
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.jsunparser", "unparser-jackson"));
        addSerializer(UnknownNode.class, new UnknownNodeSerializer());
        addDeserializer(UnknownNode.class, new UnknownNodeDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);

        // Explicitly add the mixin to every record as well
        // (mixin inheritance from interfaces may not work consistently across Java versions)
        for (Class<? extends Node> kind : NodeKinds.all()) {
            context.setMixInAnnotations(kind, NodeMixin.class);
        }
    }

    // The kind name is kept visible so UnknownNode can record it
    @JsonTypeInfo(use = JsonTypeInfo.Id.CUSTOM, include = JsonTypeInfo.As.PROPERTY, property = "type", visible = true)
    @JsonTypeIdResolver(NodeTypeIdResolver.class)
    private abstract static class NodeMixin {
    }

    // ==================== Unknown kinds ====================

    private static class UnknownNodeDeserializer extends StdDeserializer<UnknownNode> {

        UnknownNodeDeserializer() {
            super(UnknownNode.class);
        }

        @Override
        public UnknownNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode tree = ctxt.readTree(p);
            return new UnknownNode(tree.path("type").asText(null), tree.toString());
        }
    }

    private static class UnknownNodeSerializer extends StdSerializer<UnknownNode> {
        private static final ObjectMapper RAW_READER = new ObjectMapper();

        UnknownNodeSerializer() {
            super(UnknownNode.class);
        }

        @Override
        public void serialize(UnknownNode value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (isJsonObject(value.raw())) {
                gen.writeRawValue(value.raw());
                return;
            }
            // Raw text that is not JSON (e.g. source text) is kept as a member
            gen.writeStartObject();
            gen.writeStringField("type", value.type());
            if (value.raw() != null) {
                gen.writeStringField("raw", value.raw());
            }
            gen.writeEndObject();
        }

        @Override
        public void serializeWithType(UnknownNode value, JsonGenerator gen, SerializerProvider provider,
                                      TypeSerializer typeSer) throws IOException {
            // The raw JSON already carries its own "type"
            serialize(value, gen, provider);
        }

        private static boolean isJsonObject(String raw) {
            if (raw == null) {
                return false;
            }
            try {
                return RAW_READER.readTree(raw).isObject();
            } catch (JsonProcessingException e) {
                return false;
            }
        }
    }
}
