package com.pagechains.analytics.chains;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Memoizes computations by key with at most one computation in flight per key.
 *
 * <p>The first caller for a key runs the computation on its own thread; concurrent callers for the
 * same key receive the same future. A failed computation is dropped so the next request retries.
 * Once more than {@code maxEntries} keys are held, the oldest completed entries are evicted; entries
 * still computing are never evicted.</p>
 */
public final class ComputeOnceCache<K, V> {
    private final int maxEntries;
    private final Map<K, CompletableFuture<V>> entries = new LinkedHashMap<>();

    public ComputeOnceCache(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    public CompletableFuture<V> request(K key, Supplier<? extends V> computation) {
        CompletableFuture<V> created;
        synchronized (entries) {
            CompletableFuture<V> existing = entries.get(key);
            if (existing != null) {
                return existing;
            }
            created = new CompletableFuture<>();
            entries.put(key, created);
            evictOverflow();
        }

        try {
            created.complete(computation.get());
        } catch (RuntimeException | Error ex) {
            synchronized (entries) {
                entries.remove(key, created);
            }
            created.completeExceptionally(ex);
            if (ex instanceof Error) {
                throw (Error) ex;
            }
        }
        return created;
    }

    /** Blocking variant of {@link #request}; rethrows the computation's own runtime exception. */
    public V get(K key, Supplier<? extends V> computation) {
        try {
            return request(key, computation).join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException) {
                throw (RuntimeException) ex.getCause();
            }
            throw ex;
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public void invalidate(K key) {
        synchronized (entries) {
            entries.remove(key);
        }
    }

    private void evictOverflow() {
        Iterator<CompletableFuture<V>> oldestFirst = entries.values().iterator();
        while (entries.size() > maxEntries && oldestFirst.hasNext()) {
            if (oldestFirst.next().isDone()) {
                oldestFirst.remove();
            }
        }
    }
}
