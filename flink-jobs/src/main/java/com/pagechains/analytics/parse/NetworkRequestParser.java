package com.pagechains.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import com.pagechains.analytics.model.Initiator;
import com.pagechains.analytics.model.InitiatorType;
import com.pagechains.analytics.model.RequestPriority;
import com.pagechains.analytics.model.RequestRecord;
import com.pagechains.analytics.model.ResourceType;
import com.pagechains.analytics.pageload.PageLoadSignal;
import com.pagechains.analytics.quality.ValidatedEvent;
import com.pagechains.analytics.util.StringSemantics;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for `network_request` events.
 */
final class NetworkRequestParser {
    static final String EVENT_TYPE = "network_request";

    private NetworkRequestParser() {}

    static List<PageLoadSignal> parse(ValidatedEvent event) throws Exception {
        JsonNode data = ParseSupport.requireData(event, EVENT_TYPE);

        PageLoadSignal signal = new PageLoadSignal();
        signal.signalType = PageLoadSignal.SignalType.NETWORK_REQUEST;
        signal.pageLoadId = event.event.pageLoadId;
        signal.signalTimestamp = event.event.timestamp;
        signal.record = toRequestRecord(data);
        signal.sourceEvent = event.event;

        List<PageLoadSignal> results = new ArrayList<>(1);
        results.add(signal);
        return results;
    }

    static RequestRecord toRequestRecord(JsonNode data) throws Exception {
        RequestRecord record = new RequestRecord();
        record.requestId = ParseSupport.requireText(data, "request_id", EVENT_TYPE);
        record.url = ParseSupport.requireText(data, "url", EVENT_TYPE);
        // Unrecognized values become UNKNOWN and are classified as non-critical.
        record.resourceType = ResourceType.fromWire(JsonNodeUtils.asNullableText(data.path("resource_type")));
        record.priority = RequestPriority.fromWire(JsonNodeUtils.asNullableText(data.path("priority")));
        record.frameId = StringSemantics.trimToNull(JsonNodeUtils.asNullableText(data.path("frame_id")));
        record.initiator = toInitiator(data.path("initiator"));

        record.startTime = ParseSupport.optionalSeconds(data, "start_time", 0.0);
        record.responseReceivedTime = ParseSupport.optionalSeconds(data, "response_received_time", record.startTime);
        record.endTime = ParseSupport.optionalSeconds(data, "end_time", record.responseReceivedTime);

        record.statusCode = JsonNodeUtils.asIntOrDefault(data.path("status_code"), 0);
        record.mimeType = StringSemantics.trimToNull(JsonNodeUtils.asNullableText(data.path("mime_type")));
        record.transferSize = Math.max(0L, JsonNodeUtils.asLongOrDefault(data.path("transfer_size"), 0L));
        record.redirectDestination = StringSemantics.trimToNull(
                JsonNodeUtils.asNullableText(data.path("redirect_destination")));
        record.isLinkPreload = JsonNodeUtils.asBooleanOrDefault(data.path("is_link_preload"), false);
        record.finished = JsonNodeUtils.asBooleanOrDefault(data.path("finished"), true);
        record.failed = JsonNodeUtils.asBooleanOrDefault(data.path("failed"), false);
        return record;
    }

    private static Initiator toInitiator(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        Initiator initiator = new Initiator(
                InitiatorType.fromWire(JsonNodeUtils.asNullableText(node.path("type"))),
                StringSemantics.trimToNull(JsonNodeUtils.asNullableText(node.path("url"))));
        initiator.requestId = StringSemantics.trimToNull(JsonNodeUtils.asNullableText(node.path("request_id")));
        return initiator;
    }
}
