package com.pagechains.analytics.chains;

import com.pagechains.analytics.util.StringSemantics;

import java.io.Serializable;

/**
 * Identifies the top-level document of a page load by request id, URL, or both.
 * When both are set the request id is tried first.
 */
public final class RootDocument implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String requestId;
    private final String url;

    private RootDocument(String requestId, String url) {
        this.requestId = StringSemantics.trimToNull(requestId);
        this.url = StringSemantics.trimToNull(url);
    }

    public static RootDocument of(String requestId, String url) {
        if (StringSemantics.isBlank(requestId) && StringSemantics.isBlank(url)) {
            throw new IllegalArgumentException("Root document needs a request id or a URL");
        }
        return new RootDocument(requestId, url);
    }

    public static RootDocument ofRequestId(String requestId) {
        return of(requestId, null);
    }

    public static RootDocument ofUrl(String url) {
        return of(null, url);
    }

    public String requestId() {
        return requestId;
    }

    public String url() {
        return url;
    }

    @Override
    public String toString() {
        return "RootDocument{requestId=" + requestId + ", url=" + url + "}";
    }
}
