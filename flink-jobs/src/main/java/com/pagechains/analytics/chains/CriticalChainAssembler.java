package com.pagechains.analytics.chains;

import com.pagechains.analytics.model.RequestRecord;
import com.pagechains.analytics.rules.ClassifierRules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the critical request chain forest for one page load.
 *
 * <p>Steps:
 * - index records and collapse redirect hops into chains;
 * - locate the main document and classify every record against it;
 * - give each record one parent: its redirect source for a later hop, otherwise the terminal hop
 *   of the chain its initiator resolves to;
 * - keep a record only if it and every ancestor up to the root is critical;
 * - attach kept records under their parent through an id-keyed node arena, so the result does not
 *   depend on input order.
 * </p>
 *
 * <p>Instances are stateless and safe to share; each call works on its own arena.</p>
 */
public final class CriticalChainAssembler {
    private static final Logger LOG = LoggerFactory.getLogger(CriticalChainAssembler.class);

    private final ClassifierRules rules;

    public CriticalChainAssembler(ClassifierRules rules) {
        if (rules == null) {
            throw new IllegalArgumentException("classifier rules are required");
        }
        this.rules = rules;
    }

    public ChainForest assemble(Collection<RequestRecord> records, RootDocument root) {
        if (records == null || records.isEmpty()) {
            return ChainForest.empty();
        }

        RequestRegistry registry = RequestRegistry.index(records);
        RedirectChains chains = RedirectCollapser.collapse(registry);
        InitiatorResolver resolver = new InitiatorResolver(registry);

        RequestRecord mainResource = registry.locateMainResource(root);
        RedirectChain rootChain = chains.chainOf(mainResource.requestId);
        RequestRecord rootRecord = rootChain.head();
        RequestRecord rootInitiator = resolver.resolve(rootRecord);
        if (rootInitiator != null) {
            throw new MalformedNetworkRecordsException(
                    MalformedNetworkRecordsException.Reason.ROOT_HAS_INITIATOR,
                    "Root request " + rootRecord.requestId + " was initiated by " + rootInitiator.requestId);
        }

        CriticalityClassifier classifier =
                new CriticalityClassifier(rules, rootChain.requestIds(), mainResource.frameId);
        Map<String, CriticalityVerdict> verdicts = new HashMap<>();
        Map<String, String> parentIds = new HashMap<>();
        for (RequestRecord record : registry.records()) {
            RedirectChain chain = chains.chainOf(record.requestId);
            verdicts.put(record.requestId, classifier.classify(record, chain));
            String parentId = parentIdOf(record, chain, registry, chains, resolver);
            if (parentId != null) {
                parentIds.put(record.requestId, parentId);
            }
        }

        Map<String, Boolean> connected = new HashMap<>();
        Map<String, ChainNode> arena = new LinkedHashMap<>();
        ChainNode rootNode = arena.computeIfAbsent(rootRecord.requestId, id -> new ChainNode(registry.get(id)));
        for (RequestRecord record : inStartOrder(registry.records())) {
            if (record == rootRecord
                    || !isConnected(record.requestId, rootRecord.requestId, verdicts, parentIds, connected)) {
                continue;
            }
            ChainNode parent = arena.computeIfAbsent(parentIds.get(record.requestId), id -> new ChainNode(registry.get(id)));
            ChainNode child = arena.computeIfAbsent(record.requestId, id -> new ChainNode(registry.get(id)));
            parent.attach(child);
        }

        LOG.debug("Assembled critical chains (root={}, records={}, critical={})",
                rootRecord.requestId, registry.size(), arena.size());
        return ChainForest.of(rootNode);
    }

    // Siblings are attached in start order so the result does not depend on input order.
    private static List<RequestRecord> inStartOrder(Collection<RequestRecord> records) {
        List<RequestRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparingDouble((RequestRecord record) -> record.startTime)
                .thenComparing(record -> record.requestId));
        return ordered;
    }

    private static String parentIdOf(
            RequestRecord record,
            RedirectChain chain,
            RequestRegistry registry,
            RedirectChains chains,
            InitiatorResolver resolver) {
        RequestRecord redirectSource = registry.redirectSourceOf(record.requestId);
        if (redirectSource != null) {
            return redirectSource.requestId;
        }
        RequestRecord initiator = resolver.resolve(record);
        if (initiator == null) {
            return null;
        }
        RedirectChain initiatorChain = chains.chainOf(initiator.requestId);
        // An initiator inside the record's own chain would make the chain its own ancestor.
        if (initiatorChain == chain) {
            return null;
        }
        // Dependents of a redirected fetch hang off its last hop.
        return initiatorChain.terminal().requestId;
    }

    /**
     * Walks parent links upward until the root, a non-critical record, a missing parent or a cycle,
     * then records the outcome for every record on the walk.
     */
    private static boolean isConnected(
            String requestId,
            String rootId,
            Map<String, CriticalityVerdict> verdicts,
            Map<String, String> parentIds,
            Map<String, Boolean> connected) {
        List<String> walked = new ArrayList<>();
        Set<String> onWalk = new HashSet<>();
        String current = requestId;
        Boolean outcome = null;
        while (outcome == null) {
            Boolean known = connected.get(current);
            if (known != null) {
                outcome = known;
            } else if (current.equals(rootId)) {
                outcome = Boolean.TRUE;
            } else if (!onWalk.add(current)) {
                outcome = Boolean.FALSE;
            } else {
                walked.add(current);
                String parentId = parentIds.get(current);
                if (!verdicts.get(current).isCritical() || parentId == null) {
                    outcome = Boolean.FALSE;
                } else {
                    current = parentId;
                }
            }
        }
        for (String id : walked) {
            connected.put(id, outcome);
        }
        return outcome;
    }
}
