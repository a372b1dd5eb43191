package com.pagechains.analytics.chains;

import com.pagechains.analytics.model.RequestRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request in the critical chain forest and the requests it directly blocked, in discovery order.
 */
public final class ChainNode {
    private final RequestRecord request;
    private final Map<String, ChainNode> children = new LinkedHashMap<>();

    ChainNode(RequestRecord request) {
        this.request = request;
    }

    public RequestRecord request() {
        return request;
    }

    public String requestId() {
        return request.requestId;
    }

    public Map<String, ChainNode> children() {
        return Collections.unmodifiableMap(children);
    }

    public ChainNode child(String requestId) {
        return children.get(requestId);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    void attach(ChainNode child) {
        children.putIfAbsent(child.requestId(), child);
    }
}
