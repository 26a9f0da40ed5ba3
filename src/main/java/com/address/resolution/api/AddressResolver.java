package com.address.resolution.api;

import com.address.resolution.cache.CacheConfig;
import com.address.resolution.cache.CaffeineLookupCache;
import com.address.resolution.cache.LookupCache;
import com.address.resolution.core.model.Candidate;
import com.address.resolution.core.model.DropReason;
import com.address.resolution.core.model.OutputRecord;
import com.address.resolution.core.model.ScoredCandidate;
import com.address.resolution.extract.FieldExtractor;
import com.address.resolution.fetch.FetchFailedException;
import com.address.resolution.fetch.FetchOptions;
import com.address.resolution.fetch.FetchOrchestrator;
import com.address.resolution.fetch.LookupClient;
import com.address.resolution.logging.LogContext;
import com.address.resolution.metrics.MetricsService;
import com.address.resolution.metrics.NoOpMetricsService;
import com.address.resolution.ogcio.CandidateFlattener;
import com.address.resolution.ogcio.MalformedSuggestionException;
import com.address.resolution.ratelimit.LeakyBucketRateLimiter;
import com.address.resolution.ratelimit.RateLimiter;
import com.address.resolution.rules.AddressNormalizer;
import com.address.resolution.similarity.AddressScorer;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Resolves a batch of free-text addresses to structured output records.
 *
 * <p>For each address: normalize, fetch suggestions (shared rate limit and in-flight cap,
 * retried with backoff), flatten, score the candidates against the original address,
 * and extract the best one. An address that fails at any stage is dropped and logged;
 * it never aborts the batch.</p>
 *
 * <pre>
 * try (AddressResolver resolver = AddressResolver.builder()
 *         .lookupClient(OgcioLookupClient.createDefault())
 *         .rateLimit(20)
 *         .build()) {
 *     BatchResult result = resolver.resolveBatch(addresses);
 * }
 * </pre>
 */
public class AddressResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AddressResolver.class);

    private final AddressNormalizer normalizer;
    private final FetchOrchestrator orchestrator;
    private final RateLimiter rateLimiter;
    private final CandidateFlattener flattener;
    private final AddressScorer scorer;
    private final FieldExtractor extractor;
    private final LookupCache cache;
    private final MetricsService metrics;

    private AddressResolver(Builder builder, RateLimiter rateLimiter) {
        this.normalizer = builder.normalizer;
        this.rateLimiter = rateLimiter;
        this.orchestrator = new FetchOrchestrator(builder.lookupClient, rateLimiter,
                builder.fetchOptions, builder.metrics);
        this.flattener = builder.flattener;
        this.scorer = builder.scorer;
        this.extractor = builder.extractor;
        this.cache = CaffeineLookupCache.create(builder.cacheConfig);
        this.metrics = builder.metrics;
    }

    /**
     * Resolves every address and waits for the whole batch.
     */
    public BatchResult resolveBatch(List<String> addresses) {
        try {
            return resolveBatchAsync(addresses).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while resolving batch", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Batch resolution failed", e.getCause());
        }
    }

    /**
     * Resolves every address concurrently. Records and dropped entries keep input order.
     */
    public CompletableFuture<BatchResult> resolveBatchAsync(List<String> addresses) {
        String batchId = LogContext.generateBatchId();
        try (LogContext ctx = LogContext.forBatch(batchId)) {
            log.info("batch.started size={}", addresses.size());
        }
        metrics.recordBatchSize(addresses.size());

        List<CompletableFuture<Outcome>> futures = new ArrayList<>(addresses.size());
        for (int i = 0; i < addresses.size(); i++) {
            futures.add(resolveOne(batchId, i, addresses.get(i)));
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> collect(batchId, addresses.size(), futures));
    }

    /**
     * Resolves a single address.
     */
    public Optional<OutputRecord> resolve(String address) {
        BatchResult result = resolveBatch(List.of(address));
        return result.records().stream().findFirst();
    }

    private CompletableFuture<Outcome> resolveOne(String batchId, int index, String address) {
        if (address == null || address.isBlank()) {
            return CompletableFuture.completedFuture(
                    drop(batchId, index, address, DropReason.INVALID_INPUT, "blank address"));
        }

        String normalized = normalizer.normalize(address);
        return cache.get(normalized, orchestrator::fetchOrFail)
                .handle((suggestions, error) -> error == null
                        ? toOutcome(batchId, index, address, suggestions)
                        : failed(batchId, index, address, error));
    }

    private Outcome failed(String batchId, int index, String address, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;
        if (cause instanceof FetchFailedException) {
            return drop(batchId, index, address, DropReason.NO_SUGGESTIONS, cause.getMessage());
        }
        return drop(batchId, index, address, DropReason.SCORING_FAILED, cause.toString());
    }

    private Outcome toOutcome(String batchId, int index, String address, Optional<ArrayNode> suggestions) {
        if (suggestions.isEmpty()) {
            return drop(batchId, index, address, DropReason.NO_SUGGESTIONS, "no suggestions returned");
        }

        try (LogContext ctx = LogContext.forAddress(batchId, index)) {
            List<Candidate> candidates;
            try {
                ctx.with(LogContext.STAGE, "flatten");
                candidates = flattener.flatten(suggestions.get());
            } catch (MalformedSuggestionException e) {
                return drop(batchId, index, address, DropReason.MALFORMED_SUGGESTION, e.getMessage());
            }

            try {
                ctx.with(LogContext.STAGE, "score");
                ScoredCandidate best = scorer.selectBest(candidates, address);
                OutputRecord record = extractor.extract(best, address);
                metrics.recordSimilarityScore(best.score());
                metrics.incrementResolved();
                log.debug("address.resolved address='{}' rank={} score={}", address, best.rank(), best.score());
                return new Outcome(record, null);
            } catch (RuntimeException e) {
                return drop(batchId, index, address, DropReason.SCORING_FAILED, e.toString());
            }
        }
    }

    private Outcome drop(String batchId, int index, String address, DropReason reason, String detail) {
        try (LogContext ctx = LogContext.forAddress(batchId, index)) {
            if (reason == DropReason.NO_SUGGESTIONS) {
                log.info("address.dropped reason={} address='{}' detail={}", reason, address, detail);
            } else {
                log.warn("address.dropped reason={} address='{}' detail={}", reason, address, detail);
            }
        }
        metrics.incrementDropped(reason);
        return new Outcome(null, new DroppedAddress(index, address, reason, detail));
    }

    private BatchResult collect(String batchId, int inputCount, List<CompletableFuture<Outcome>> futures) {
        List<OutputRecord> records = new ArrayList<>();
        List<DroppedAddress> dropped = new ArrayList<>();
        for (CompletableFuture<Outcome> future : futures) {
            Outcome outcome = future.join();
            if (outcome.record() != null) {
                records.add(outcome.record());
            } else {
                dropped.add(outcome.dropped());
            }
        }
        BatchResult result = new BatchResult(inputCount, records, dropped);
        try (LogContext ctx = LogContext.forBatch(batchId)) {
            log.info("batch.completed result={} cache={}", result, cache.getStats());
        }
        return result;
    }

    public LookupCache getCache() {
        return cache;
    }

    @Override
    public void close() {
        orchestrator.close();
        rateLimiter.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    private record Outcome(OutputRecord record, DroppedAddress dropped) {}

    public static class Builder {
        private static final double DEFAULT_RATE_LIMIT = 20;

        private LookupClient lookupClient;
        private RateLimiter rateLimiter;
        private double rateLimit = DEFAULT_RATE_LIMIT;
        private FetchOptions fetchOptions = FetchOptions.defaults();
        private AddressNormalizer normalizer = AddressNormalizer.createDefault();
        private CandidateFlattener flattener = new CandidateFlattener();
        private AddressScorer scorer = new AddressScorer();
        private FieldExtractor extractor = new FieldExtractor();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private MetricsService metrics = new NoOpMetricsService();

        public Builder lookupClient(LookupClient lookupClient) {
            this.lookupClient = lookupClient;
            return this;
        }

        /**
         * Uses the given limiter instead of creating one from {@link #rateLimit(double)}.
         */
        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder rateLimit(double rateLimit) {
            if (Double.isNaN(rateLimit) || rateLimit <= 0) {
                throw new IllegalArgumentException("rateLimit must be positive, got " + rateLimit);
            }
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder fetchOptions(FetchOptions fetchOptions) {
            this.fetchOptions = Objects.requireNonNull(fetchOptions, "fetchOptions");
            return this;
        }

        public Builder normalizer(AddressNormalizer normalizer) {
            this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
            return this;
        }

        public Builder flattener(CandidateFlattener flattener) {
            this.flattener = Objects.requireNonNull(flattener, "flattener");
            return this;
        }

        public Builder scorer(AddressScorer scorer) {
            this.scorer = Objects.requireNonNull(scorer, "scorer");
            return this;
        }

        public Builder extractor(FieldExtractor extractor) {
            this.extractor = Objects.requireNonNull(extractor, "extractor");
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metrics) {
            this.metrics = metrics != null ? metrics : new NoOpMetricsService();
            return this;
        }

        public AddressResolver build() {
            Objects.requireNonNull(lookupClient, "lookupClient is required");
            RateLimiter limiter = rateLimiter != null ? rateLimiter : new LeakyBucketRateLimiter(rateLimit);
            return new AddressResolver(this, limiter);
        }
    }
}
