package com.pagechains.analytics.model;

import com.pagechains.analytics.util.StringSemantics;

/**
 * Closed set of resource types reported by the network recorder.
 *
 * <p>Values the recorder does not send (or that a newer recorder adds) map to {@link #UNKNOWN},
 * which classification treats as non-critical.</p>
 */
public enum ResourceType {
    DOCUMENT("Document"),
    STYLESHEET("Stylesheet"),
    IMAGE("Image"),
    MEDIA("Media"),
    FONT("Font"),
    SCRIPT("Script"),
    TEXT_TRACK("TextTrack"),
    XHR("XHR"),
    FETCH("Fetch"),
    EVENT_SOURCE("EventSource"),
    WEB_SOCKET("WebSocket"),
    MANIFEST("Manifest"),
    SIGNED_EXCHANGE("SignedExchange"),
    PING("Ping"),
    CSP_VIOLATION_REPORT("CSPViolationReport"),
    PREFLIGHT("Preflight"),
    OTHER("Other"),
    UNKNOWN("");

    private final String wireName;

    ResourceType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ResourceType fromWire(String value) {
        if (StringSemantics.isBlank(value)) {
            return UNKNOWN;
        }
        String trimmed = value.trim();
        for (ResourceType type : values()) {
            if (type != UNKNOWN && type.wireName.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
