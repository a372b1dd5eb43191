package com.pagechains.analytics.model;

import java.io.Serializable;

/**
 * DLQ/quarantine envelope: where the event came from, why it was rejected and its original body.
 */
public class RejectedEventEnvelope implements Serializable {
    private static final long serialVersionUID = 1L;

    public String schemaVersion;
    public SourcePointer source;
    public FailureDetails failure;
    public Identity identity;
    public EventDimensions dimensions;
    public Payload payload;
    public String dedupKey;
    public String dedupStrategy;
    public boolean replay;
    public long ingestionTimestamp;
    public Long eventTimestamp;

    public RejectedEventEnvelope() {}

    public static class SourcePointer implements Serializable {
        private static final long serialVersionUID = 1L;

        public String topic;
        public int partition;
        public long offset;
        public long recordTimestamp;

        public SourcePointer() {}
    }

    public static class FailureDetails implements Serializable {
        private static final long serialVersionUID = 1L;

        public String stage;
        public String failureClass;
        public String reason;
        public String details;

        public FailureDetails() {}
    }

    public static class Identity implements Serializable {
        private static final long serialVersionUID = 1L;

        public String eventId;
        public String eventType;
        public String eventVersion;

        public Identity() {}
    }

    /**
     * Page-level dimensions used to slice DLQ volume.
     */
    public static class EventDimensions implements Serializable {
        private static final long serialVersionUID = 1L;

        public String pageLoadId;
        public String origin;
        public String recorder;

        public EventDimensions() {}
    }

    public static class Payload implements Serializable {
        private static final long serialVersionUID = 1L;

        public String encoding;
        public String body;
        public String canonicalJson;

        public Payload() {}
    }
}
