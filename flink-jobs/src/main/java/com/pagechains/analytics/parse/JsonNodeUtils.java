package com.pagechains.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Shared JSON helper methods for parsing optional fields with safe defaults.
 */
public final class JsonNodeUtils {
    private JsonNodeUtils() {}

    public static Long parseTimestampMillis(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            String raw = node.asText().trim();
            if (raw.isEmpty() || !raw.matches("\\d+")) {
                return null;
            }
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    public static long parseTimestampMillisOrDefault(JsonNode node, long defaultValue) {
        Long parsed = parseTimestampMillis(node);
        return parsed == null ? defaultValue : parsed;
    }

    /** Text of a scalar node; numbers are rendered as text. Empty strings count as absent. */
    public static String asNullableText(JsonNode node) {
        if (isAbsent(node) || node.isContainerNode()) {
            return null;
        }
        String value = node.asText();
        return value == null || value.isEmpty() ? null : value;
    }

    public static Integer asNullableInt(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            String raw = node.asText().trim();
            if (raw.isEmpty()) {
                return null;
            }
            try {
                return Integer.parseInt(raw);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    public static Long asNullableLong(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            String raw = node.asText().trim();
            if (raw.isEmpty()) {
                return null;
            }
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    public static Double asNullableDouble(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            String raw = node.asText().trim();
            if (raw.isEmpty()) {
                return null;
            }
            try {
                double parsed = Double.parseDouble(raw);
                return Double.isFinite(parsed) ? parsed : null;
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    public static int asIntOrDefault(JsonNode node, int defaultValue) {
        Integer value = asNullableInt(node);
        return value == null ? defaultValue : value;
    }

    public static long asLongOrDefault(JsonNode node, long defaultValue) {
        Long value = asNullableLong(node);
        return value == null ? defaultValue : value;
    }

    public static boolean asBooleanOrDefault(JsonNode node, boolean defaultValue) {
        if (isAbsent(node)) {
            return defaultValue;
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isTextual()) {
            String raw = node.asText().trim();
            if ("true".equalsIgnoreCase(raw)) {
                return true;
            }
            if ("false".equalsIgnoreCase(raw)) {
                return false;
            }
        }
        return defaultValue;
    }

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }
}
