package com.pagechains.analytics.model;

import com.pagechains.analytics.util.StringSemantics;

/**
 * Loading priority assigned by the browser. Ordered from {@link #VERY_LOW} to {@link #VERY_HIGH};
 * {@link #UNKNOWN} sits outside the ordering and never satisfies {@link #isAtLeast(RequestPriority)}.
 */
public enum RequestPriority {
    UNKNOWN("", -1),
    VERY_LOW("VeryLow", 0),
    LOW("Low", 1),
    MEDIUM("Medium", 2),
    HIGH("High", 3),
    VERY_HIGH("VeryHigh", 4);

    private final String wireName;
    private final int rank;

    RequestPriority(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isAtLeast(RequestPriority minimum) {
        if (this == UNKNOWN || minimum == null || minimum == UNKNOWN) {
            return false;
        }
        return rank >= minimum.rank;
    }

    public static RequestPriority fromWire(String value) {
        if (StringSemantics.isBlank(value)) {
            return UNKNOWN;
        }
        String trimmed = value.trim();
        for (RequestPriority priority : values()) {
            if (priority != UNKNOWN && priority.wireName.equalsIgnoreCase(trimmed)) {
                return priority;
            }
        }
        return UNKNOWN;
    }
}
