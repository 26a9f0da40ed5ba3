package com.address.resolution.cache;

import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Lookup cache that always loads, for when caching is disabled.
 */
public class NoOpLookupCache implements LookupCache {

    @Override
    public CompletableFuture<Optional<ArrayNode>> get(String normalizedQuery,
                                                      Function<String, CompletableFuture<Optional<ArrayNode>>> loader) {
        return loader.apply(normalizedQuery);
    }

    @Override
    public void invalidateAll() {
        // nothing cached
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
