package com.pagechains.analytics.chains;

import com.pagechains.analytics.model.RequestRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One logical fetch: its wire-level hops in redirect order. Most chains have a single hop.
 */
public final class RedirectChain {
    private final List<RequestRecord> hops;

    RedirectChain(List<RequestRecord> hops) {
        if (hops.isEmpty()) {
            throw new IllegalArgumentException("redirect chain needs at least one hop");
        }
        this.hops = Collections.unmodifiableList(new ArrayList<>(hops));
    }

    /** First hop; its id is the chain's identity. */
    public RequestRecord head() {
        return hops.get(0);
    }

    public RequestRecord terminal() {
        return hops.get(hops.size() - 1);
    }

    public List<RequestRecord> hops() {
        return hops;
    }

    public int size() {
        return hops.size();
    }

    public boolean isRedirected() {
        return hops.size() > 1;
    }

    public boolean isTerminal(RequestRecord record) {
        return record == terminal();
    }

    public Set<String> requestIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (RequestRecord hop : hops) {
            ids.add(hop.requestId);
        }
        return ids;
    }
}
