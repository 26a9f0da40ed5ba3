package com.address.resolution.cache;

import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Cache of lookup outcomes keyed by normalized query.
 */
public interface LookupCache {

    /**
     * Returns the cached outcome for {@code normalizedQuery}, starting {@code loader} when there
     * is none. Concurrent callers for the same key share a single load. A load that completed
     * exceptionally is not kept: the next call for the key loads again.
     */
    CompletableFuture<Optional<ArrayNode>> get(String normalizedQuery,
                                               Function<String, CompletableFuture<Optional<ArrayNode>>> loader);

    /**
     * Invalidates all cache entries.
     */
    void invalidateAll();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();
}
