package com.pagechains.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;

import com.pagechains.analytics.parse.JsonNodeUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lightweight schema validator that enforces required fields per event type and supported versions.
 */
public class SchemaValidator {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(SchemaValidator.class);

    public static final String NETWORK_REQUEST = "network_request";
    public static final String PAGE_LOAD_COMPLETE = "page_load_complete";

    private final Set<String> supportedVersions;
    private final Map<String, List<String>> requiredFieldsByType;

    public SchemaValidator(Set<String> supportedVersions) {
        this.supportedVersions = supportedVersions;
        this.requiredFieldsByType = buildRequiredFields();
    }

    public ValidationResult validate(JsonNode root) {
        if (root == null || !root.isObject()) {
            LOG.debug("Schema validation failed: root is null or not an object");
            return ValidationResult.invalid("SCHEMA_INVALID", "root_not_object", "Root node is missing or not an object");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            LOG.debug("Schema validation failed: missing or invalid type");
            return ValidationResult.invalid("SCHEMA_INVALID", "missing_type", "Event type is missing or not a string");
        }

        // Numeric strings are accepted; some recorders serialize every number as a string.
        Long tsValue = JsonNodeUtils.parseTimestampMillis(root.get("timestamp"));
        if (tsValue == null) {
            LOG.debug("Schema validation failed: missing or non-numeric timestamp");
            return ValidationResult.invalid("SCHEMA_INVALID", "missing_timestamp", "Event timestamp is missing or not numeric");
        }

        JsonNode dataNode = root.get("data");
        if (dataNode == null || !dataNode.isObject()) {
            LOG.debug("Schema validation failed: missing data object for type {}", typeNode.asText());
            return ValidationResult.invalid("SCHEMA_INVALID", "missing_data", "Event data payload is missing or not an object");
        }

        String eventType = typeNode.asText();
        if (!requiredFieldsByType.containsKey(eventType)) {
            LOG.debug("Schema validation failed: unsupported event type {}", eventType);
            return ValidationResult.invalid("SCHEMA_INVALID", "unsupported_event_type", "Unsupported event type: " + eventType);
        }

        String eventVersion = extractVersion(root);
        if (eventVersion != null && !supportedVersions.isEmpty() && !supportedVersions.contains(eventVersion)) {
            LOG.debug("Schema validation failed: unsupported version {} for type {}", eventVersion, eventType);
            return ValidationResult.invalid("UNSUPPORTED_VERSION", "unsupported_version", "Unsupported event version: " + eventVersion);
        }

        for (String requiredPath : requiredFieldsByType.getOrDefault(eventType, Collections.emptyList())) {
            JsonNode node = resolvePath(root, requiredPath);
            if (node == null || node.isMissingNode() || node.isNull() || (node.isTextual() && node.asText().isEmpty())) {
                LOG.debug("Schema validation failed: missing required field {}", requiredPath);
                return ValidationResult.invalid("SCHEMA_INVALID", "missing_field", "Missing required field: " + requiredPath);
            }
        }

        if (NETWORK_REQUEST.equals(eventType)) {
            JsonNode initiator = dataNode.get("initiator");
            if (initiator != null && !initiator.isNull() && !initiator.isObject()) {
                LOG.debug("Schema validation failed: initiator is not an object");
                return ValidationResult.invalid("SCHEMA_INVALID", "invalid_initiator", "Expected initiator object");
            }
        }

        if (PAGE_LOAD_COMPLETE.equals(eventType)) {
            // The root document can be named by URL, by request id, or both.
            String url = JsonNodeUtils.asNullableText(dataNode.get("main_document_url"));
            String requestId = JsonNodeUtils.asNullableText(dataNode.get("main_request_id"));
            if (url == null && requestId == null) {
                LOG.debug("Schema validation failed: page_load_complete without a main document");
                return ValidationResult.invalid("SCHEMA_INVALID", "missing_field",
                        "Missing required field: data.main_document_url or data.main_request_id");
            }
        }

        return ValidationResult.valid(eventVersion);
    }

    private static Map<String, List<String>> buildRequiredFields() {
        Map<String, List<String>> map = new HashMap<>();
        map.put(NETWORK_REQUEST, Arrays.asList(
                "data.request_id",
                "data.url"
        ));
        map.put(PAGE_LOAD_COMPLETE, Collections.emptyList());
        return map;
    }

    private static JsonNode resolvePath(JsonNode root, String dotPath) {
        JsonNode current = root;
        String[] parts = dotPath.split("\\.");
        for (String part : parts) {
            if (current == null) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }

    static String extractVersion(JsonNode root) {
        if (root == null) {
            return null;
        }
        JsonNode versionNode = root.get("version");
        if (versionNode == null || versionNode.isMissingNode() || versionNode.isNull()) {
            versionNode = root.path("data").get("version");
        }
        if (versionNode == null || versionNode.isMissingNode() || versionNode.isNull()) {
            return null;
        }
        if (versionNode.isTextual()) {
            return versionNode.asText();
        }
        if (versionNode.isNumber()) {
            return String.valueOf(versionNode.asInt());
        }
        return versionNode.asText(null);
    }

    public static class ValidationResult {
        public final boolean valid;
        public final String failureClass;
        public final String reason;
        public final String details;
        public final String eventVersion;

        private ValidationResult(boolean valid, String failureClass, String reason, String details, String eventVersion) {
            this.valid = valid;
            this.failureClass = failureClass;
            this.reason = reason;
            this.details = details;
            this.eventVersion = eventVersion;
        }

        public static ValidationResult valid(String eventVersion) {
            return new ValidationResult(true, null, null, null, eventVersion == null ? "1" : eventVersion);
        }

        public static ValidationResult invalid(String failureClass, String reason, String details) {
            return new ValidationResult(false, failureClass, reason, details, null);
        }
    }
}
