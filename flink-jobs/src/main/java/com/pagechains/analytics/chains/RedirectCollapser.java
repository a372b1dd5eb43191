package com.pagechains.analytics.chains;

import com.pagechains.analytics.model.RequestRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups redirect hops into logical chains by following {@code redirectDestination} links.
 */
public final class RedirectCollapser {
    private RedirectCollapser() {}

    public static RedirectChains collapse(RequestRegistry registry) {
        Map<String, RedirectChain> byRequestId = new HashMap<>();
        List<RedirectChain> chains = new ArrayList<>();

        for (RequestRecord record : registry.records()) {
            if (registry.redirectSourceOf(record.requestId) != null) {
                continue;
            }
            List<RequestRecord> hops = new ArrayList<>();
            RequestRecord hop = record;
            while (hop != null) {
                if (byRequestId.containsKey(hop.requestId) || hops.contains(hop)) {
                    throw new MalformedNetworkRecordsException(
                            MalformedNetworkRecordsException.Reason.REDIRECT_CYCLE,
                            "Redirect chain starting at " + record.requestId + " revisits " + hop.requestId);
                }
                hops.add(hop);
                hop = registry.redirectDestinationOf(hop);
            }
            RedirectChain chain = new RedirectChain(hops);
            chains.add(chain);
            for (RequestRecord member : hops) {
                byRequestId.put(member.requestId, chain);
            }
        }

        // Anything left has a redirect source but no head: the hops form a loop.
        if (byRequestId.size() != registry.size()) {
            for (RequestRecord record : registry.records()) {
                if (!byRequestId.containsKey(record.requestId)) {
                    throw new MalformedNetworkRecordsException(
                            MalformedNetworkRecordsException.Reason.REDIRECT_CYCLE,
                            "Request " + record.requestId + " is part of a redirect cycle");
                }
            }
        }
        return new RedirectChains(byRequestId, chains);
    }
}
