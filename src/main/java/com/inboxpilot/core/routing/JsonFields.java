package com.inboxpilot.core.routing;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.OptionalDouble;

/**
 * Small helpers for reading classifier JSON.
 */
final class JsonFields {

    private JsonFields() {}

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : "";
    }

    /**
     * @return empty when absent, NaN when present but not a number in [0, 1]
     */
    static OptionalDouble confidence(JsonNode node) {
        JsonNode value = node.get("confidence");
        if (value == null || value.isNull()) {
            return OptionalDouble.empty();
        }
        if (!value.isNumber() || value.asDouble() < 0.0 || value.asDouble() > 1.0) {
            return OptionalDouble.of(Double.NaN);
        }
        return OptionalDouble.of(value.asDouble());
    }
}
