package com.pagechains.analytics.model;

import com.pagechains.analytics.util.StringSemantics;

/**
 * What kind of context triggered a request.
 */
public enum InitiatorType {
    PARSER("parser"),
    SCRIPT("script"),
    PRELOAD("preload"),
    SIGNED_EXCHANGE("SignedExchange"),
    PREFLIGHT("preflight"),
    OTHER("other"),
    UNKNOWN("");

    private final String wireName;

    InitiatorType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static InitiatorType fromWire(String value) {
        if (StringSemantics.isBlank(value)) {
            return UNKNOWN;
        }
        String trimmed = value.trim();
        for (InitiatorType type : values()) {
            if (type != UNKNOWN && type.wireName.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
