package com.pagechains.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import com.pagechains.analytics.model.RequestRecord;
import com.pagechains.analytics.pageload.PageLoadSignal;
import com.pagechains.analytics.quality.ValidatedEvent;
import com.pagechains.analytics.util.StringSemantics;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses validated recorder events into page-load signals.
 */
public final class PageEventParsers {
    private PageEventParsers() {}

    public static List<PageLoadSignal> parseNetworkRequest(ValidatedEvent e) throws Exception {
        return NetworkRequestParser.parse(e);
    }

    public static List<PageLoadSignal> parsePageLoadComplete(ValidatedEvent e) throws Exception {
        JsonNode data = ParseSupport.requireData(e, "page_load_complete");

        PageLoadSignal signal = new PageLoadSignal();
        signal.signalType = PageLoadSignal.SignalType.PAGE_LOAD_COMPLETE;
        signal.pageLoadId = e.event.pageLoadId;
        signal.signalTimestamp = e.event.timestamp;
        signal.mainDocumentUrl = StringSemantics.trimToNull(JsonNodeUtils.asNullableText(data.path("main_document_url")));
        signal.mainRequestId = StringSemantics.trimToNull(JsonNodeUtils.asNullableText(data.path("main_request_id")));
        if (signal.mainDocumentUrl == null && signal.mainRequestId == null) {
            throw new Exception("page_load_complete names no main document");
        }
        signal.sourceEvent = e.event;

        List<PageLoadSignal> results = new ArrayList<>(1);
        results.add(signal);
        return results;
    }

    /** Reads the {@code data} object of a network_request event, or a bare record in the same shape. */
    public static RequestRecord toRequestRecord(JsonNode data) throws Exception {
        if (data == null || !data.isObject()) {
            throw new Exception("Request record must be a JSON object");
        }
        return NetworkRequestParser.toRequestRecord(data);
    }
}
