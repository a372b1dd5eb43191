package com.pagechains.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import com.pagechains.analytics.model.PageEvent;
import com.pagechains.analytics.util.JsonSupport;

import static org.junit.jupiter.api.Assertions.*;

class DedupKeyTest {

    @Test
    void usesEventIdWhenPresent() throws Exception {
        PageEvent event = event("evt-123",
                "{\"id\":\"evt-123\",\"type\":\"network_request\",\"timestamp\":1,\"data\":{\"request_id\":\"r1\",\"url\":\"https://a.test/\"}}");

        QualityGateProcessFunction.DedupKey dedupKey = QualityGateProcessFunction.DedupKey.build(event, root(event));

        assertEquals("evt-123", dedupKey.key);
        assertEquals("event_id", dedupKey.strategy);
    }

    @Test
    void replayedPayloadHashesLikeOriginal() throws Exception {
        PageEvent original = event("",
                "{\"type\":\"network_request\",\"timestamp\":1,\"data\":{\"url\":\"https://a.test/\",\"request_id\":\"r1\"}}");
        PageEvent replayed = event("",
                "{\"type\":\"network_request\",\"timestamp\":1,\"data\":{\"url\":\"https://a.test/\",\"request_id\":\"r1\"},"
                        + "\"__replay\":true,\"__replay_ts\":99,\"__replay_source\":\"dlq\","
                        + "\"__replay_failure_class\":\"PARSING_FAILED\",\"__replay_failure_reason\":\"parse_exception\"}");

        QualityGateProcessFunction.DedupKey first = QualityGateProcessFunction.DedupKey.build(original, root(original));
        QualityGateProcessFunction.DedupKey second = QualityGateProcessFunction.DedupKey.build(replayed, root(replayed));

        assertEquals("payload_hash", first.strategy);
        assertEquals(first.key, second.key);
    }

    @Test
    void samePayloadInAnotherPageLoadIsDistinct() throws Exception {
        String json = "{\"type\":\"network_request\",\"timestamp\":1,\"data\":{\"request_id\":\"r1\",\"url\":\"https://a.test/\"}}";
        PageEvent first = event("", json);
        PageEvent second = event("", json);
        second.pageLoadId = "pl-2";

        assertNotEquals(
                QualityGateProcessFunction.DedupKey.build(first, root(first)).key,
                QualityGateProcessFunction.DedupKey.build(second, root(second)).key);
    }

    private static PageEvent event(String eventId, String rawJson) {
        PageEvent event = new PageEvent();
        event.eventId = eventId;
        event.eventType = "network_request";
        event.pageLoadId = "pl-1";
        event.rawJson = rawJson;
        return event;
    }

    private static JsonNode root(PageEvent event) throws Exception {
        return JsonSupport.MAPPER.readTree(event.rawJson);
    }
}
