package com.address.resolution.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class LookupCacheTest {

    private static final ArrayNode SUGGESTIONS = new ObjectMapper().createArrayNode().add("suggestion");

    private static Function<String, CompletableFuture<Optional<ArrayNode>>> countingLoader(AtomicInteger calls) {
        return query -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(Optional.of(SUGGESTIONS));
        };
    }

    @Nested
    @DisplayName("NoOpLookupCache")
    class NoOpTests {

        @Test
        @DisplayName("Should load every time")
        void testAlwaysLoads() {
            NoOpLookupCache cache = new NoOpLookupCache();
            AtomicInteger calls = new AtomicInteger();

            cache.get("香港", countingLoader(calls)).join();
            cache.get("香港", countingLoader(calls)).join();

            assertEquals(2, calls.get());
            assertEquals(CacheStats.empty(), cache.getStats());
        }
    }

    @Nested
    @DisplayName("CaffeineLookupCache")
    class CaffeineTests {

        @Test
        @DisplayName("Repeated query is served from the cache")
        void testHit() {
            CaffeineLookupCache cache = new CaffeineLookupCache(CacheConfig.defaults());
            AtomicInteger calls = new AtomicInteger();

            Optional<ArrayNode> first = cache.get("香港", countingLoader(calls)).join();
            Optional<ArrayNode> second = cache.get("香港", countingLoader(calls)).join();

            assertEquals(1, calls.get());
            assertSame(first.orElseThrow(), second.orElseThrow());
            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(0.5, stats.hitRate(), 1e-9);
        }

        @Test
        @DisplayName("Concurrent callers share one in-flight load")
        void testInFlightDeduplication() {
            CaffeineLookupCache cache = new CaffeineLookupCache(CacheConfig.defaults());
            CompletableFuture<Optional<ArrayNode>> pending = new CompletableFuture<>();
            AtomicInteger calls = new AtomicInteger();
            Function<String, CompletableFuture<Optional<ArrayNode>>> loader = query -> {
                calls.incrementAndGet();
                return pending;
            };

            CompletableFuture<Optional<ArrayNode>> a = cache.get("旺角", loader);
            CompletableFuture<Optional<ArrayNode>> b = cache.get("旺角", loader);
            pending.complete(Optional.empty());

            assertEquals(1, calls.get());
            assertTrue(a.join().isEmpty());
            assertTrue(b.join().isEmpty());
        }

        @Test
        @DisplayName("A failed load is reloaded on the next call")
        void testFailedLoadNotKept() {
            CaffeineLookupCache cache = new CaffeineLookupCache(CacheConfig.defaults());
            AtomicInteger calls = new AtomicInteger();
            Function<String, CompletableFuture<Optional<ArrayNode>>> failing = query -> {
                calls.incrementAndGet();
                return CompletableFuture.failedFuture(new IllegalStateException("lookup failed"));
            };

            CompletableFuture<Optional<ArrayNode>> failed = cache.get("香港", failing);
            Optional<ArrayNode> reloaded = cache.get("香港", countingLoader(calls)).join();

            assertTrue(failed.isCompletedExceptionally());
            assertSame(SUGGESTIONS, reloaded.orElseThrow());
            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("Callers waiting on a failing load share the failure")
        void testInFlightFailureShared() {
            CaffeineLookupCache cache = new CaffeineLookupCache(CacheConfig.defaults());
            CompletableFuture<Optional<ArrayNode>> pending = new CompletableFuture<>();
            AtomicInteger calls = new AtomicInteger();
            Function<String, CompletableFuture<Optional<ArrayNode>>> loader = query -> {
                calls.incrementAndGet();
                return pending;
            };

            CompletableFuture<Optional<ArrayNode>> a = cache.get("旺角", loader);
            CompletableFuture<Optional<ArrayNode>> b = cache.get("旺角", loader);
            pending.completeExceptionally(new IllegalStateException("lookup failed"));

            assertTrue(a.isCompletedExceptionally());
            assertTrue(b.isCompletedExceptionally());
            assertEquals(1, calls.get());

            assertTrue(cache.get("旺角", countingLoader(calls)).join().isPresent());
            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("invalidateAll forces a reload")
        void testInvalidate() {
            CaffeineLookupCache cache = new CaffeineLookupCache(CacheConfig.defaults());
            AtomicInteger calls = new AtomicInteger();

            cache.get("香港", countingLoader(calls)).join();
            cache.invalidateAll();
            cache.get("香港", countingLoader(calls)).join();

            assertEquals(2, calls.get());
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class ConfigTests {

        @Test
        @DisplayName("Disabled config creates a no-op cache")
        void testFactory() {
            assertInstanceOf(NoOpLookupCache.class, CaffeineLookupCache.create(CacheConfig.disabled()));
            assertInstanceOf(NoOpLookupCache.class, CaffeineLookupCache.create(null));
            assertInstanceOf(CaffeineLookupCache.class, CaffeineLookupCache.create(CacheConfig.defaults()));
        }

        @Test
        @DisplayName("Should reject non-positive sizes and TTLs")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 10, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        }
    }
}
