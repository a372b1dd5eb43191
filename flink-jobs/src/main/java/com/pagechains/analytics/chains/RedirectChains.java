package com.pagechains.analytics.chains;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of collapsing a page load's redirects: every request id maps to the chain it is a hop of.
 */
public final class RedirectChains {
    private final Map<String, RedirectChain> byRequestId;
    private final List<RedirectChain> chains;

    RedirectChains(Map<String, RedirectChain> byRequestId, List<RedirectChain> chains) {
        this.byRequestId = byRequestId;
        this.chains = Collections.unmodifiableList(chains);
    }

    public RedirectChain chainOf(String requestId) {
        return requestId == null ? null : byRequestId.get(requestId);
    }

    /** Chains in the input order of their head hop. */
    public List<RedirectChain> chains() {
        return chains;
    }
}
