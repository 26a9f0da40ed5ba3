package com.address.resolution.cache;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Caffeine-backed lookup cache. Entries are futures, so a repeated address that arrives while
 * the first lookup is still in flight waits for it instead of issuing a second call.
 *
 * <p>A failed load is shared by the callers already waiting on it and then evicted, so the
 * next call for the same query loads again.</p>
 */
public class CaffeineLookupCache implements LookupCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineLookupCache.class);

    private final AsyncCache<String, Loaded> cache;

    public CaffeineLookupCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .buildAsync();
        log.info("CaffeineLookupCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    /**
     * Creates the cache described by {@code config}, or a no-op cache when it is disabled.
     */
    public static LookupCache create(CacheConfig config) {
        return config != null && config.enabled() ? new CaffeineLookupCache(config) : new NoOpLookupCache();
    }

    @Override
    public CompletableFuture<Optional<ArrayNode>> get(String normalizedQuery,
                                                      Function<String, CompletableFuture<Optional<ArrayNode>>> loader) {
        AtomicBoolean started = new AtomicBoolean();
        CompletableFuture<Loaded> entry = load(normalizedQuery, loader, started);
        if (!started.get() && entry.isDone() && entry.join().failed()) {
            // an earlier failed load that is not evicted yet
            cache.asMap().remove(normalizedQuery, entry);
            entry = load(normalizedQuery, loader, started);
        }
        return entry.thenCompose(Loaded::toFuture);
    }

    private CompletableFuture<Loaded> load(String normalizedQuery,
                                           Function<String, CompletableFuture<Optional<ArrayNode>>> loader,
                                           AtomicBoolean started) {
        CompletableFuture<Loaded> entry = cache.get(normalizedQuery, (key, executor) -> {
            started.set(true);
            return loader.apply(key).handle((value, error) -> new Loaded(value, error));
        });
        entry.thenAccept(loaded -> {
            if (loaded.failed() && cache.asMap().remove(normalizedQuery, entry)) {
                log.debug("Evicted failed lookup: query='{}'", normalizedQuery);
            }
        });
        return entry;
    }

    @Override
    public void invalidateAll() {
        cache.synchronous().invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.synchronous().stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.synchronous().estimatedSize()
        );
    }

    /**
     * Outcome of one load. Failures are held as values so Caffeine keeps them until evicted here.
     */
    private record Loaded(Optional<ArrayNode> value, Throwable error) {

        boolean failed() {
            return error != null;
        }

        CompletableFuture<Optional<ArrayNode>> toFuture() {
            return failed() ? CompletableFuture.failedFuture(error) : CompletableFuture.completedFuture(value);
        }
    }
}
