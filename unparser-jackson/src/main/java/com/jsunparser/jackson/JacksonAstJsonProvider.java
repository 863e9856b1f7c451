package com.jsunparser.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsunparser.ast.Node;
import com.jsunparser.ast.Program;
import com.jsunparser.json.AstJsonDeserializer;
import com.jsunparser.json.AstJsonException;
import com.jsunparser.json.AstJsonProvider;
import com.jsunparser.json.AstJsonSerializer;

/**
 * Registered under META-INF/services; reads and writes trees with a mapper from
 * {@link UnparserJackson#createObjectMapper()} unless one is supplied.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(UnparserJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.serializer = new JacksonSerializer(mapper);
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

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException(describe(node), "Failed to serialize " + describe(node) + " node", e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException(describe(node), "Failed to serialize " + describe(node) + " node", e);
            }
        }

        private static String describe(Node node) {
            return node == null ? "null" : node.type();
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
                    throw new AstJsonException(type.getSimpleName(), "Expected " + type.getSimpleName() + " but found null");
                }
                return node;
            } catch (AstJsonException e) {
                throw e;
            } catch (Exception e) {
                throw new AstJsonException(type.getSimpleName(), "Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
            }
        }
    }
}
