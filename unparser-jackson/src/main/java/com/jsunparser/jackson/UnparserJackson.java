package com.jsunparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for syntax trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = UnparserJackson.createObjectMapper();
 * Program program = mapper.readValue(json, Program.class);
 * String json = mapper.writeValueAsString(program);
 * </pre>
 */
public final class UnparserJackson {

    private UnparserJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for reading and writing trees.
     *
     * The returned mapper:
     * - Handles polymorphic Node types via the "type" property
     * - Leaves absent optional children out of the output
     * - Ignores members the records do not declare
     * - Reads unrecognised kinds as UnknownNode
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Absent optional children (no else branch, bare return, ...) are omitted
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Producers may attach positions and other members we do not model
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        // Null, This and Debugger have no components
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
