package com.pagechains.analytics.model;

import java.io.Serializable;

/**
 * One observed network fetch, as emitted by the recorder.
 *
 * <p>Times are in seconds on the recorder's monotonic clock. {@code redirectDestination} holds the
 * request id of the hop this request redirected into, when there was one.</p>
 */
public class RequestRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    public String requestId;
    public String url;
    public ResourceType resourceType = ResourceType.UNKNOWN;
    public RequestPriority priority = RequestPriority.UNKNOWN;
    public String frameId;
    public Initiator initiator;
    public double startTime;
    public double responseReceivedTime;
    public double endTime;
    public int statusCode;
    public String mimeType;
    public long transferSize;
    public String redirectDestination;
    public boolean isLinkPreload;
    public boolean finished;
    public boolean failed;

    public RequestRecord() {}
}
