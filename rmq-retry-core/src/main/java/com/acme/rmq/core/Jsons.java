package com.acme.rmq.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

/** JSON wire format of message bodies. Bodies are UTF-8 encoded JSON. */
public final class Jsons {
    private static final ObjectMapper M =
            new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private Jsons() {}

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (Exception e) {
            throw new TransientException("Failed to serialize message to JSON", e);
        }
    }

    public static byte[] toBytes(Object o) {
        try {
            return M.writeValueAsBytes(o);
        } catch (Exception e) {
            throw new TransientException("Failed to serialize message to JSON", e);
        }
    }

    /**
     * Parse a message body into a key-value mapping.
     *
     * @throws TransientException if the body is not a single valid JSON document or its top level
     *     is not an object
     */
    public static Map<String, Object> toMap(byte[] body) {
        if (body == null || body.length == 0) {
            throw new TransientException("Message body is empty");
        }
        JsonNode node;
        try {
            node = M.readTree(body);
        } catch (Exception e) {
            throw new TransientException("Message body is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new TransientException(
                    "Message body must be a JSON object but was "
                            + (node == null ? "empty" : node.getNodeType()));
        }
        return M.convertValue(node, MAP_TYPE);
    }
}
