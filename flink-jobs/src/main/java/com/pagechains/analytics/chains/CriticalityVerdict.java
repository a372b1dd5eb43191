package com.pagechains.analytics.chains;

/**
 * Outcome of classifying one request, with the rule that decided it.
 */
public enum CriticalityVerdict {
    ROOT_DOCUMENT(true),
    CRITICAL(true),
    LINK_PRELOAD(false),
    NON_NETWORK(false),
    FAVICON(false),
    SUB_FRAME_DOCUMENT(false),
    UNCLASSIFIED(false),
    NOT_RENDER_BLOCKING(false),
    LOW_PRIORITY(false);

    private final boolean critical;

    CriticalityVerdict(boolean critical) {
        this.critical = critical;
    }

    public boolean isCritical() {
        return critical;
    }
}
