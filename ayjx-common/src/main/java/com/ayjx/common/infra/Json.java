package com.ayjx.common.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Process-wide JSON mapper for wire frames.
 */
public final class Json {

    private Json() {
    }

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Parse a text frame that must hold a JSON object.
     *
     * @throws JsonProcessingException if the text is not JSON or not an object
     */
    public static ObjectNode parseObject(String text) throws JsonProcessingException {
        JsonNode node = MAPPER.readTree(text);
        if (node == null || !node.isObject()) {
            throw new JsonProcessingException("expected a JSON object") {
            };
        }
        return (ObjectNode) node;
    }

    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    /** Compact serialisation; Jackson trees never fail to serialise. */
    public static String write(JsonNode node) {
        return node.toString();
    }
}
