package com.pagechains.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import com.pagechains.analytics.quality.ValidatedEvent;

/**
 * Shared parser support helpers.
 */
final class ParseSupport {
    private ParseSupport() {}

    static JsonNode requireData(ValidatedEvent event, String eventType) throws Exception {
        JsonNode data = event.data();
        if (data == null || data.isMissingNode() || data.isNull()) {
            throw new Exception("Missing data payload for " + eventType);
        }
        return data;
    }

    static String requireText(JsonNode data, String field, String eventType) throws Exception {
        String value = JsonNodeUtils.asNullableText(data.path(field));
        if (value == null || value.trim().isEmpty()) {
            throw new Exception("Missing " + field + " for " + eventType);
        }
        return value.trim();
    }

    /** Absent numbers take the fallback; present but non-numeric values are rejected. */
    static double optionalSeconds(JsonNode data, String field, double fallback) throws Exception {
        JsonNode node = data.path(field);
        if (JsonNodeUtils.isAbsent(node)) {
            return fallback;
        }
        Double value = JsonNodeUtils.asNullableDouble(node);
        if (value == null) {
            throw new Exception("Invalid numeric value for " + field + ": " + node);
        }
        if (value < 0) {
            throw new Exception("Negative value for " + field + ": " + value);
        }
        return value;
    }
}
