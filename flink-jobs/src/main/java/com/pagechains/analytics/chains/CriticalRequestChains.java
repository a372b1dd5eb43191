package com.pagechains.analytics.chains;

import com.pagechains.analytics.model.RequestRecord;
import com.pagechains.analytics.rules.ClassifierRules;
import com.pagechains.analytics.rules.ClassifierRulesLoader;

import java.util.Collection;

/**
 * Entry point for computing critical request chains, optionally memoized per caller-chosen key.
 */
public final class CriticalRequestChains {
    public static final int DEFAULT_CACHE_ENTRIES = 256;

    private final CriticalChainAssembler assembler;
    private final ComputeOnceCache<String, ChainForest> cache;

    public CriticalRequestChains(ClassifierRules rules, int maxCachedEntries) {
        this.assembler = new CriticalChainAssembler(rules);
        this.cache = new ComputeOnceCache<>(maxCachedEntries);
    }

    public static CriticalRequestChains withDefaultRules() {
        return new CriticalRequestChains(ClassifierRulesLoader.loadDefault(), DEFAULT_CACHE_ENTRIES);
    }

    public ChainForest compute(Collection<RequestRecord> records, RootDocument root) {
        return assembler.assemble(records, root);
    }

    /**
     * Same as {@link #compute} but shares one computation among callers using the same key.
     * The key must identify the input; a reused key returns the earlier result.
     */
    public ChainForest request(String cacheKey, Collection<RequestRecord> records, RootDocument root) {
        return cache.get(cacheKey, () -> compute(records, root));
    }

    int cachedEntries() {
        return cache.size();
    }
}
