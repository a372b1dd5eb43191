package com.pagechains.analytics.model;

import java.io.Serializable;

/**
 * Recorder event metadata derived from a raw Kafka record by the quality gate.
 */
public class PageEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    public String eventId;
    public String eventType;
    public String eventVersion;
    public String pageLoadId;
    public String recorder;
    public String rawJson;
    public long timestamp;
    public String dedupKey;
    public String dedupStrategy;
    public boolean replay;
    public RejectedEventEnvelope.SourcePointer source;
    public RejectedEventEnvelope.EventDimensions dimensions;

    public PageEvent() {}
}
