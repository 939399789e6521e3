package com.clapgrow.inbox.api.normalizer;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Map;

/**
 * Typed lookups over loosely shaped webhook JSON. A field of the wrong type is
 * treated the same as a missing one.
 */
final class JsonFields {

    private JsonFields() {
    }

    /** String value of {@code field}, or null if absent or not a string. */
    static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    static String textOrEmpty(JsonNode node, String field) {
        String value = text(node, field);
        return value != null ? value : "";
    }

    /** Object value of {@code field}, or null if absent or not an object. */
    static JsonNode object(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isObject() ? value : null;
    }

    /** Elements of the array at {@code field}; empty if absent or not an array. */
    static Iterable<JsonNode> array(JsonNode node, String field) {
        if (node == null) {
            return Collections.emptyList();
        }
        JsonNode value = node.get(field);
        return value != null && value.isArray() ? value : Collections.emptyList();
    }

    static boolean isNonEmptyArray(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isArray() && !value.isEmpty();
    }

    /**
     * Copies a timestamp field into metadata. Meta sends epoch millis as numbers for
     * Messenger and epoch seconds as strings for WhatsApp; both are kept as sent.
     */
    static void putTimestamp(JsonNode node, Map<String, Object> metadata) {
        JsonNode value = node != null ? node.get("timestamp") : null;
        if (value == null) {
            return;
        }
        if (value.isTextual()) {
            metadata.put("timestamp", value.asText());
        } else if (value.isIntegralNumber()) {
            metadata.put("timestamp", value.asLong());
        } else if (value.isNumber()) {
            metadata.put("timestamp", value.asDouble());
        }
    }
}
