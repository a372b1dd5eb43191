package com.pagechains.analytics.model;

import java.io.Serializable;

/**
 * Back-reference describing what triggered a request. Either field may be missing.
 */
public class Initiator implements Serializable {
    private static final long serialVersionUID = 1L;

    public InitiatorType type = InitiatorType.UNKNOWN;
    public String url;
    // Set by recorders that know the initiating request directly; wins over URL matching.
    public String requestId;

    public Initiator() {}

    public Initiator(InitiatorType type, String url) {
        this.type = type == null ? InitiatorType.UNKNOWN : type;
        this.url = url;
    }
}
