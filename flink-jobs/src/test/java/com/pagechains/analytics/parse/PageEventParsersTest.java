package com.pagechains.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import com.pagechains.analytics.model.InitiatorType;
import com.pagechains.analytics.model.PageEvent;
import com.pagechains.analytics.model.RequestPriority;
import com.pagechains.analytics.model.RequestRecord;
import com.pagechains.analytics.model.ResourceType;
import com.pagechains.analytics.pageload.PageLoadSignal;
import com.pagechains.analytics.quality.ValidatedEvent;
import com.pagechains.analytics.util.JsonSupport;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageEventParsersTest {

    @Test
    void networkRequestBecomesRequestSignal() throws Exception {
        String rawJson = readResource("fixtures/network_request.json");
        ValidatedEvent event = buildValidatedEvent(JsonSupport.MAPPER.readTree(rawJson), rawJson);

        List<PageLoadSignal> signals = PageEventParsers.parseNetworkRequest(event);

        assertEquals(1, signals.size());
        PageLoadSignal signal = signals.get(0);
        assertEquals(PageLoadSignal.SignalType.NETWORK_REQUEST, signal.signalType);
        assertEquals("pl-shop-0001", signal.pageLoadId);
        assertSame(event.event, signal.sourceEvent);

        RequestRecord record = signal.record;
        assertEquals("r7", record.requestId);
        assertEquals(ResourceType.SCRIPT, record.resourceType);
        assertEquals(RequestPriority.HIGH, record.priority);
        assertEquals("F1", record.frameId);
        assertEquals(InitiatorType.PARSER, record.initiator.type);
        assertEquals("https://shop.example.com/", record.initiator.url);
        assertEquals("r0", record.initiator.requestId);
        assertEquals(0.36, record.startTime, 1e-9);
        assertEquals(0.5, record.responseReceivedTime, 1e-9);
        assertEquals(0.5, record.endTime, 1e-9, "end time defaults to response time");
        assertEquals(0L, record.transferSize, "negative sizes are clamped");
        assertFalse(record.isLinkPreload);
        assertTrue(record.finished);
        assertFalse(record.failed);
    }

    @Test
    void unknownEnumsMapToUnknown() throws Exception {
        JsonNode data = JsonSupport.MAPPER.readTree(
                "{\"request_id\":\"a\",\"url\":\"https://x.test/\",\"resource_type\":\"Prefetch\",\"priority\":\"Urgent\","
                        + "\"initiator\":{\"type\":\"magic\"}}");

        RequestRecord record = PageEventParsers.toRequestRecord(data);

        assertEquals(ResourceType.UNKNOWN, record.resourceType);
        assertEquals(RequestPriority.UNKNOWN, record.priority);
        assertEquals(InitiatorType.UNKNOWN, record.initiator.type);
        assertNull(record.initiator.url);
        assertEquals(0.0, record.startTime);
    }

    @Test
    void nonNumericTimingIsRejected() throws Exception {
        JsonNode data = JsonSupport.MAPPER.readTree(
                "{\"request_id\":\"a\",\"url\":\"https://x.test/\",\"start_time\":\"soon\"}");

        Exception ex = assertThrows(Exception.class, () -> PageEventParsers.toRequestRecord(data));
        assertTrue(ex.getMessage().contains("start_time"));
    }

    @Test
    void negativeTimingIsRejected() throws Exception {
        JsonNode data = JsonSupport.MAPPER.readTree(
                "{\"request_id\":\"a\",\"url\":\"https://x.test/\",\"end_time\":-1}");

        assertThrows(Exception.class, () -> PageEventParsers.toRequestRecord(data));
    }

    @Test
    void missingRequestIdIsRejected() throws Exception {
        JsonNode data = JsonSupport.MAPPER.readTree("{\"url\":\"https://x.test/\"}");

        assertThrows(Exception.class, () -> PageEventParsers.toRequestRecord(data));
        assertThrows(Exception.class, () -> PageEventParsers.toRequestRecord(JsonSupport.MAPPER.readTree("[]")));
    }

    @Test
    void pageLoadCompleteNamesMainDocument() throws Exception {
        String rawJson = "{\"id\":\"evt-done\",\"type\":\"page_load_complete\",\"timestamp\":1710000005000,"
                + "\"data\":{\"page_load_id\":\"pl-1\",\"main_document_url\":\"https://shop.example.com/\"}}";
        ValidatedEvent event = buildValidatedEvent(JsonSupport.MAPPER.readTree(rawJson), rawJson);

        List<PageLoadSignal> signals = PageEventParsers.parsePageLoadComplete(event);

        assertEquals(1, signals.size());
        assertEquals(PageLoadSignal.SignalType.PAGE_LOAD_COMPLETE, signals.get(0).signalType);
        assertEquals("https://shop.example.com/", signals.get(0).mainDocumentUrl);
        assertNull(signals.get(0).mainRequestId);
        assertNull(signals.get(0).record);
    }

    @Test
    void pageLoadCompleteWithoutMainDocumentFails() throws Exception {
        String rawJson = "{\"id\":\"evt-done\",\"type\":\"page_load_complete\",\"timestamp\":1,\"data\":{\"main_request_id\":\"  \"}}";
        ValidatedEvent event = buildValidatedEvent(JsonSupport.MAPPER.readTree(rawJson), rawJson);

        assertThrows(Exception.class, () -> PageEventParsers.parsePageLoadComplete(event));
    }

    @Test
    void reparsesRawJsonWhenTreeWasDropped() throws Exception {
        String rawJson = readResource("fixtures/network_request.json");
        ValidatedEvent event = buildValidatedEvent(JsonSupport.MAPPER.readTree(rawJson), rawJson);
        event.root = null;
        event.data = null;

        assertEquals("r7", PageEventParsers.parseNetworkRequest(event).get(0).record.requestId);
    }

    private static ValidatedEvent buildValidatedEvent(JsonNode root, String rawJson) {
        PageEvent event = new PageEvent();
        event.eventId = root.path("id").asText("");
        event.eventType = root.path("type").asText("");
        event.eventVersion = "1";
        event.pageLoadId = root.path("data").path("page_load_id").asText("pl-1");
        event.timestamp = JsonNodeUtils.parseTimestampMillisOrDefault(root.path("timestamp"), System.currentTimeMillis());
        event.rawJson = rawJson;
        return new ValidatedEvent(event, root);
    }

    private static String readResource(String resourceName) throws Exception {
        return new String(
                PageEventParsersTest.class.getClassLoader().getResourceAsStream(resourceName).readAllBytes(),
                StandardCharsets.UTF_8);
    }
}
