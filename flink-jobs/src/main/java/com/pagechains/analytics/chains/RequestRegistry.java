package com.pagechains.analytics.chains;

import com.pagechains.analytics.model.RequestRecord;
import com.pagechains.analytics.model.ResourceType;
import com.pagechains.analytics.util.StringSemantics;
import com.pagechains.analytics.util.UrlNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Id and URL index over one page load's request records.
 *
 * <p>Records may arrive in any order; every lookup is by id or URL, never by position. URLs are
 * indexed without their fragment.</p>
 */
public final class RequestRegistry {
    private final Map<String, RequestRecord> byId;
    private final Map<String, List<RequestRecord>> byUrl;
    private final Map<String, RequestRecord> redirectSources;

    private RequestRegistry(
            Map<String, RequestRecord> byId,
            Map<String, List<RequestRecord>> byUrl,
            Map<String, RequestRecord> redirectSources) {
        this.byId = byId;
        this.byUrl = byUrl;
        this.redirectSources = redirectSources;
    }

    public static RequestRegistry index(Collection<RequestRecord> records) {
        Map<String, RequestRecord> byId = new LinkedHashMap<>();
        Map<String, List<RequestRecord>> byUrl = new HashMap<>();
        for (RequestRecord record : records) {
            if (record == null || StringSemantics.isBlank(record.requestId)) {
                throw new MalformedNetworkRecordsException(
                        MalformedNetworkRecordsException.Reason.MISSING_REQUEST_ID,
                        "Request record without a request id"
                                + (record == null ? "" : " (url=" + record.url + ")"));
            }
            RequestRecord previous = byId.putIfAbsent(record.requestId, record);
            if (previous != null) {
                throw new MalformedNetworkRecordsException(
                        MalformedNetworkRecordsException.Reason.DUPLICATE_REQUEST_ID,
                        "Duplicate request id: " + record.requestId);
            }
            String key = urlKey(record.url);
            if (key != null) {
                byUrl.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
            }
        }

        Map<String, RequestRecord> redirectSources = new HashMap<>();
        for (RequestRecord record : byId.values()) {
            String destination = StringSemantics.trimToNull(record.redirectDestination);
            // A destination outside this page load ends the chain at this hop.
            if (destination == null || !byId.containsKey(destination)) {
                continue;
            }
            if (destination.equals(record.requestId)) {
                throw new MalformedNetworkRecordsException(
                        MalformedNetworkRecordsException.Reason.REDIRECT_CYCLE,
                        "Request " + record.requestId + " redirects to itself");
            }
            RequestRecord claimed = redirectSources.putIfAbsent(destination, record);
            if (claimed != null) {
                throw new MalformedNetworkRecordsException(
                        MalformedNetworkRecordsException.Reason.REDIRECT_DESTINATION_CLAIMED,
                        "Request " + destination + " is the redirect destination of both "
                                + claimed.requestId + " and " + record.requestId);
            }
        }
        return new RequestRegistry(byId, byUrl, redirectSources);
    }

    public RequestRecord get(String requestId) {
        return requestId == null ? null : byId.get(requestId);
    }

    public boolean contains(String requestId) {
        return requestId != null && byId.containsKey(requestId);
    }

    /** Records with this URL (fragment ignored), in input order. */
    public List<RequestRecord> byUrl(String url) {
        String key = urlKey(url);
        if (key == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(byUrl.getOrDefault(key, Collections.emptyList()));
    }

    /** The hop that redirected into {@code requestId}, or null when it starts its chain. */
    public RequestRecord redirectSourceOf(String requestId) {
        return requestId == null ? null : redirectSources.get(requestId);
    }

    /** Next hop of {@code record}, or null when the record is terminal within this page load. */
    public RequestRecord redirectDestinationOf(RequestRecord record) {
        if (record == null) {
            return null;
        }
        RequestRecord destination = get(StringSemantics.trimToNull(record.redirectDestination));
        return destination == null || destination == record ? null : destination;
    }

    public Collection<RequestRecord> records() {
        return Collections.unmodifiableCollection(byId.values());
    }

    public int size() {
        return byId.size();
    }

    public boolean isEmpty() {
        return byId.isEmpty();
    }

    /**
     * Finds the record the page's main document was delivered by.
     *
     * <p>A known request id wins. Otherwise, among records with the document URL, the terminal hop
     * of a redirect chain is preferred, then a Document, then the earliest start, then the lowest
     * request id.</p>
     */
    public RequestRecord locateMainResource(RootDocument root) {
        if (root == null) {
            throw new IllegalArgumentException("root document descriptor is required");
        }
        RequestRecord byRequestId = get(root.requestId());
        if (byRequestId != null) {
            return byRequestId;
        }
        RequestRecord best = null;
        for (RequestRecord candidate : byUrl(root.url())) {
            if (best == null || preferAsMainResource(candidate, best)) {
                best = candidate;
            }
        }
        if (best == null) {
            throw new MalformedNetworkRecordsException(
                    MalformedNetworkRecordsException.Reason.ROOT_NOT_FOUND,
                    "No request record matches " + root);
        }
        return best;
    }

    private boolean preferAsMainResource(RequestRecord candidate, RequestRecord current) {
        boolean candidateTerminal = redirectDestinationOf(candidate) == null;
        boolean currentTerminal = redirectDestinationOf(current) == null;
        if (candidateTerminal != currentTerminal) {
            return candidateTerminal;
        }
        boolean candidateDocument = candidate.resourceType == ResourceType.DOCUMENT;
        boolean currentDocument = current.resourceType == ResourceType.DOCUMENT;
        if (candidateDocument != currentDocument) {
            return candidateDocument;
        }
        if (candidate.startTime != current.startTime) {
            return candidate.startTime < current.startTime;
        }
        return candidate.requestId.compareTo(current.requestId) < 0;
    }

    private static String urlKey(String url) {
        return StringSemantics.trimToNull(UrlNormalizer.withoutFragment(url));
    }
}
