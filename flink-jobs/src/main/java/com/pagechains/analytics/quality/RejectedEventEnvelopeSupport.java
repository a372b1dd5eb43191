package com.pagechains.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;

import com.pagechains.analytics.model.KafkaInboundRecord;
import com.pagechains.analytics.model.RejectedEventEnvelope;
import com.pagechains.analytics.parse.JsonNodeUtils;
import com.pagechains.analytics.util.StringSemantics;
import com.pagechains.analytics.util.UrlNormalizer;

/**
 * Shared extraction helpers for DLQ/quarantine envelope construction.
 */
public final class RejectedEventEnvelopeSupport {
    private RejectedEventEnvelopeSupport() {}

    public static RejectedEventEnvelope.SourcePointer buildSourcePointer(KafkaInboundRecord record) {
        RejectedEventEnvelope.SourcePointer source = new RejectedEventEnvelope.SourcePointer();
        if (record != null) {
            source.topic = record.topic;
            source.partition = record.partition;
            source.offset = record.offset;
            source.recordTimestamp = record.recordTimestamp;
        }
        return source;
    }

    /**
     * Page-load id comes from the payload, falling back to the Kafka key recorders partition by.
     */
    public static String extractPageLoadId(JsonNode root, KafkaInboundRecord record) {
        String fromPayload = root == null ? null : JsonNodeUtils.asNullableText(root.path("data").path("page_load_id"));
        String fromKey = record == null ? null : record.key;
        return StringSemantics.blankToNull(StringSemantics.firstNonBlank(fromPayload, fromKey));
    }

    public static RejectedEventEnvelope.EventDimensions extractDimensions(JsonNode root, KafkaInboundRecord record) {
        if (root == null) {
            return null;
        }
        JsonNode data = root.path("data");
        RejectedEventEnvelope.EventDimensions dims = new RejectedEventEnvelope.EventDimensions();
        dims.pageLoadId = extractPageLoadId(root, record);
        String url = JsonNodeUtils.asNullableText(data.path("url"));
        if (StringSemantics.isBlank(url)) {
            url = JsonNodeUtils.asNullableText(data.path("main_document_url"));
        }
        dims.origin = StringSemantics.blankToNull(UrlNormalizer.origin(url));
        dims.recorder = JsonNodeUtils.asNullableText(root.path("recorder"));
        return dims;
    }
}
