package com.pagechains.analytics.pageload;

import com.pagechains.analytics.model.PageEvent;
import com.pagechains.analytics.model.RequestRecord;

import java.io.Serializable;

/**
 * Normalized per-page-load input to chain aggregation: one observed request, or the marker that
 * the page load is complete and names its main document.
 */
public class PageLoadSignal implements Serializable {
    private static final long serialVersionUID = 1L;

    public enum SignalType {
        NETWORK_REQUEST,
        PAGE_LOAD_COMPLETE
    }

    public SignalType signalType;
    public String pageLoadId;
    public long signalTimestamp;

    public RequestRecord record;

    public String mainDocumentUrl;
    public String mainRequestId;

    public PageEvent sourceEvent;

    public PageLoadSignal() {}
}
