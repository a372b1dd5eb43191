package com.pagechains.analytics.quality;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import com.pagechains.analytics.chains.MalformedNetworkRecordsException;
import com.pagechains.analytics.model.KafkaInboundRecord;
import com.pagechains.analytics.model.PageEvent;
import com.pagechains.analytics.model.RejectedEventEnvelope;
import com.pagechains.analytics.parse.JsonNodeUtils;
import com.pagechains.analytics.util.JsonSupport;

import java.util.Base64;

/**
 * Builds DLQ/quarantine envelopes for different failure modes in the pipeline.
 */
public final class RejectedEventEnvelopeFactory {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(RejectedEventEnvelopeFactory.class);

    private RejectedEventEnvelopeFactory() {}

    public static RejectedEventEnvelope forRawRecord(
            KafkaInboundRecord record,
            String failureClass,
            String stage,
            String reason,
            String details,
            String rawJson,
            String canonicalJson,
            byte[] rawBytes) {
        RejectedEventEnvelope envelope = baseEnvelope(record, null, null, null, rawJson, canonicalJson, rawBytes, false);
        envelope.failure = buildFailure(stage, failureClass, reason, details);
        return envelope;
    }

    public static RejectedEventEnvelope forSchemaValidationFailure(
            KafkaInboundRecord record,
            JsonNode root,
            String failureClass,
            String stage,
            String reason,
            String details,
            String rawJson) {
        String canonical = null;
        try {
            canonical = JsonSupport.CANONICAL_MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            LOG.debug("Canonical JSON unavailable for rejected record: {}", ex.getMessage());
        }
        String eventId = root.path("id").asText("");
        String eventType = root.path("type").asText("");
        String eventVersion = SchemaValidator.extractVersion(root);
        Long eventTimestamp = JsonNodeUtils.parseTimestampMillis(root.path("timestamp"));
        boolean replay = root.path("__replay").asBoolean(false);

        RejectedEventEnvelope envelope = baseEnvelope(record, eventId, eventType, eventVersion, rawJson, canonical, null, replay);
        envelope.dimensions = RejectedEventEnvelopeSupport.extractDimensions(root, record);
        envelope.eventTimestamp = eventTimestamp;
        envelope.failure = buildFailure(stage, failureClass, reason, details);
        return envelope;
    }

    public static RejectedEventEnvelope forParseFailure(PageEvent event, Exception ex) {
        RejectedEventEnvelope envelope = baseEnvelopeFromEvent(event);
        envelope.failure = buildFailure("PARSE", "PARSING_FAILED", "parse_exception", describe(ex, "Unknown parse error"));
        return envelope;
    }

    /**
     * A repeat of an event its page load already accepted; {@code firstSeenAt} is the Kafka position of the
     * accepted copy.
     */
    public static RejectedEventEnvelope forDuplicateEvent(PageEvent event, String reason, String firstSeenAt) {
        RejectedEventEnvelope envelope = baseEnvelopeFromEvent(event);
        ensurePageLoadId(envelope, event.pageLoadId);
        envelope.failure = buildFailure(
                "DEDUP",
                "DUPLICATE",
                reason,
                "Page load " + event.pageLoadId + " already accepted " + event.dedupStrategy + " "
                        + event.dedupKey + " at " + firstSeenAt);
        return envelope;
    }

    /**
     * The page load's records could not be assembled; the reason code names the violated precondition.
     */
    public static RejectedEventEnvelope forAssemblyFailure(
            PageEvent event,
            String pageLoadId,
            int recordCount,
            MalformedNetworkRecordsException ex) {
        RejectedEventEnvelope envelope = baseEnvelopeFromEvent(event);
        ensurePageLoadId(envelope, pageLoadId);
        envelope.failure = buildFailure(
                "ASSEMBLY",
                "MALFORMED_RECORDS",
                ex.reason().code(),
                "Page load " + pageLoadId + " (" + recordCount + " records): " + ex.getMessage());
        return envelope;
    }

    public static RejectedEventEnvelope forIncompletePageLoad(
            PageEvent event,
            String pageLoadId,
            String reason,
            String details) {
        RejectedEventEnvelope envelope = baseEnvelopeFromEvent(event);
        ensurePageLoadId(envelope, pageLoadId);
        envelope.failure = buildFailure("ASSEMBLY", "PAGE_LOAD_INCOMPLETE", reason, details);
        return envelope;
    }

    public static RejectedEventEnvelope forResultGuardFailure(PageEvent event, String reason, String details) {
        RejectedEventEnvelope envelope = baseEnvelopeFromEvent(event);
        envelope.failure = buildFailure("RESULT_GUARD", "RECORD_TOO_LARGE", reason, details);
        return envelope;
    }

    private static RejectedEventEnvelope baseEnvelopeFromEvent(PageEvent event) {
        RejectedEventEnvelope envelope = new RejectedEventEnvelope();
        envelope.schemaVersion = "v1";
        envelope.identity = new RejectedEventEnvelope.Identity();
        envelope.payload = new RejectedEventEnvelope.Payload();
        envelope.payload.encoding = "json";
        envelope.ingestionTimestamp = System.currentTimeMillis();
        if (event == null) {
            return envelope;
        }
        envelope.source = event.source;
        envelope.identity.eventId = event.eventId;
        envelope.identity.eventType = event.eventType;
        envelope.identity.eventVersion = event.eventVersion;
        envelope.dimensions = event.dimensions;
        envelope.payload.body = event.rawJson;
        envelope.dedupKey = event.dedupKey;
        envelope.dedupStrategy = event.dedupStrategy;
        envelope.replay = event.replay;
        envelope.eventTimestamp = event.timestamp;
        return envelope;
    }

    private static RejectedEventEnvelope baseEnvelope(
            KafkaInboundRecord record,
            String eventId,
            String eventType,
            String eventVersion,
            String rawJson,
            String canonicalJson,
            byte[] rawBytes,
            boolean replay) {
        RejectedEventEnvelope envelope = new RejectedEventEnvelope();
        envelope.schemaVersion = "v1";
        envelope.source = RejectedEventEnvelopeSupport.buildSourcePointer(record);
        envelope.identity = new RejectedEventEnvelope.Identity();
        envelope.identity.eventId = eventId;
        envelope.identity.eventType = eventType;
        envelope.identity.eventVersion = eventVersion;
        envelope.payload = new RejectedEventEnvelope.Payload();
        if (rawBytes != null) {
            envelope.payload.encoding = "base64";
            envelope.payload.body = Base64.getEncoder().encodeToString(rawBytes);
        } else {
            envelope.payload.encoding = "json";
            envelope.payload.body = rawJson;
        }
        envelope.payload.canonicalJson = canonicalJson;
        envelope.ingestionTimestamp = System.currentTimeMillis();
        envelope.replay = replay;
        return envelope;
    }

    private static void ensurePageLoadId(RejectedEventEnvelope envelope, String pageLoadId) {
        // Copied so the source event's dimensions stay untouched.
        RejectedEventEnvelope.EventDimensions dims = new RejectedEventEnvelope.EventDimensions();
        if (envelope.dimensions != null) {
            dims.pageLoadId = envelope.dimensions.pageLoadId;
            dims.origin = envelope.dimensions.origin;
            dims.recorder = envelope.dimensions.recorder;
        }
        if (dims.pageLoadId == null) {
            dims.pageLoadId = pageLoadId;
        }
        envelope.dimensions = dims;
    }

    private static RejectedEventEnvelope.FailureDetails buildFailure(String stage, String failureClass, String reason, String details) {
        RejectedEventEnvelope.FailureDetails failure = new RejectedEventEnvelope.FailureDetails();
        failure.stage = stage;
        failure.failureClass = failureClass;
        failure.reason = reason;
        failure.details = details;
        return failure;
    }

    private static String describe(Exception ex, String fallback) {
        if (ex == null) {
            return fallback;
        }
        if (ex.getMessage() == null || ex.getMessage().isBlank()) {
            return ex.getClass().getName();
        }
        return ex.getClass().getName() + ": " + ex.getMessage();
    }
}
