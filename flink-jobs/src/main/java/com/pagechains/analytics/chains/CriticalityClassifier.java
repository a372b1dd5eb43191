package com.pagechains.analytics.chains;

import com.pagechains.analytics.model.InitiatorType;
import com.pagechains.analytics.model.RequestPriority;
import com.pagechains.analytics.model.RequestRecord;
import com.pagechains.analytics.model.ResourceType;
import com.pagechains.analytics.rules.ClassifierRules;
import com.pagechains.analytics.util.StringSemantics;
import com.pagechains.analytics.util.UrlNormalizer;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Decides whether a single request is on the critical rendering path, without looking at the
 * rest of the graph.
 *
 * <p>Rule order:
 * - every hop of the main document's redirect chain is critical;
 * - link preloads, non-network URLs, favicons/images, sub-frame documents and requests with an
 *   unknown type or priority are excluded;
 * - what remains is critical when its type blocks rendering and its priority meets the minimum.
 * </p>
 *
 * <p>A hop that redirects elsewhere is judged by its own type and priority when it reports both,
 * otherwise by those of the chain's terminal hop.</p>
 */
public final class CriticalityClassifier {
    private final ClassifierRules rules;
    private final Set<String> rootRequestIds;
    private final String rootFrameId;

    public CriticalityClassifier(ClassifierRules rules, Set<String> rootRequestIds, String rootFrameId) {
        this.rules = rules;
        this.rootRequestIds = rootRequestIds == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new HashSet<>(rootRequestIds));
        this.rootFrameId = StringSemantics.trimToNull(rootFrameId);
    }

    public boolean isCritical(RequestRecord record, RedirectChain chain) {
        return classify(record, chain).isCritical();
    }

    public CriticalityVerdict classify(RequestRecord record) {
        return classify(record, null);
    }

    public CriticalityVerdict classify(RequestRecord record, RedirectChain chain) {
        if (rootRequestIds.contains(record.requestId)) {
            return CriticalityVerdict.ROOT_DOCUMENT;
        }

        ResourceType type = record.resourceType;
        RequestPriority priority = record.priority;
        boolean ownAttributesKnown = type != ResourceType.UNKNOWN && priority != RequestPriority.UNKNOWN;
        if (!ownAttributesKnown && chain != null && !chain.isTerminal(record)) {
            type = chain.terminal().resourceType;
            priority = chain.terminal().priority;
        }

        if (record.isLinkPreload) {
            return CriticalityVerdict.LINK_PRELOAD;
        }
        if (rules.isNonNetworkScheme(UrlNormalizer.scheme(record.url))) {
            return CriticalityVerdict.NON_NETWORK;
        }
        if (rules.isFaviconName(UrlNormalizer.lastPathComponent(record.url))
                || rules.isExcludedMimeType(record.mimeType)) {
            return CriticalityVerdict.FAVICON;
        }
        if (type == ResourceType.DOCUMENT && isSubFrame(record.frameId)) {
            return CriticalityVerdict.SUB_FRAME_DOCUMENT;
        }
        if (type == null || type == ResourceType.UNKNOWN || priority == null || priority == RequestPriority.UNKNOWN) {
            return CriticalityVerdict.UNCLASSIFIED;
        }
        InitiatorType initiatorType = record.initiator == null ? InitiatorType.UNKNOWN : record.initiator.type;
        if (!rules.isRenderBlocking(type, initiatorType)) {
            return CriticalityVerdict.NOT_RENDER_BLOCKING;
        }
        if (!rules.meetsMinimumPriority(priority)) {
            return CriticalityVerdict.LOW_PRIORITY;
        }
        return CriticalityVerdict.CRITICAL;
    }

    private boolean isSubFrame(String frameId) {
        String normalized = StringSemantics.trimToNull(frameId);
        return rootFrameId != null && normalized != null && !rootFrameId.equals(normalized);
    }
}
