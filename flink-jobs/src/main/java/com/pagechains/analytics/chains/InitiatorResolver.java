package com.pagechains.analytics.chains;

import com.pagechains.analytics.model.Initiator;
import com.pagechains.analytics.model.InitiatorType;
import com.pagechains.analytics.model.RequestRecord;
import com.pagechains.analytics.model.ResourceType;
import com.pagechains.analytics.util.StringSemantics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Maps a request's initiator back to the record that triggered it.
 *
 * <p>Recorders usually only know the initiator's URL, and one URL can be fetched several times
 * in a page load. Candidates are narrowed step by step; a narrowing step that would leave nothing
 * is skipped. The initiator only resolves when exactly one candidate survives.</p>
 */
public final class InitiatorResolver {
    private final RequestRegistry registry;

    public InitiatorResolver(RequestRegistry registry) {
        this.registry = registry;
    }

    /** Initiating record, or null when there is none or the match is ambiguous. */
    public RequestRecord resolve(RequestRecord record) {
        if (record == null || record.initiator == null) {
            return null;
        }
        Initiator initiator = record.initiator;

        RequestRecord explicit = registry.get(StringSemantics.trimToNull(initiator.requestId));
        if (explicit != null) {
            return explicit == record ? null : explicit;
        }

        List<RequestRecord> candidates = new ArrayList<>();
        for (RequestRecord candidate : registry.byUrl(initiator.url)) {
            if (candidate == record || candidate.failed) {
                continue;
            }
            // The initiator must have had its response before this request started.
            if (candidate.responseReceivedTime > record.startTime) {
                continue;
            }
            candidates.add(candidate);
        }

        candidates = narrow(candidates, candidate -> candidate.resourceType != ResourceType.OTHER);
        candidates = narrow(candidates, candidate -> Objects.equals(candidate.frameId, record.frameId));
        if (initiator.type == InitiatorType.PARSER) {
            candidates = narrow(candidates, candidate -> candidate.resourceType == ResourceType.DOCUMENT);
        }
        return candidates.size() == 1 ? candidates.get(0) : null;
    }

    private static List<RequestRecord> narrow(List<RequestRecord> candidates, Predicate<RequestRecord> keep) {
        if (candidates.size() <= 1) {
            return candidates;
        }
        List<RequestRecord> kept = new ArrayList<>();
        for (RequestRecord candidate : candidates) {
            if (keep.test(candidate)) {
                kept.add(candidate);
            }
        }
        return kept.isEmpty() ? candidates : kept;
    }
}
