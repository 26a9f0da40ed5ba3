package com.address.resolution.fetch;

import com.address.resolution.metrics.MetricsService;
import com.address.resolution.metrics.NoOpMetricsService;
import com.address.resolution.ratelimit.RateLimiter;
import com.address.resolution.ratelimit.RateLimiterClosedException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolves queries to lookup-service suggestions with bounded concurrency and bounded retries.
 *
 * <p>Every attempt first takes a slot from the in-flight cap and then a token from the shared
 * {@link RateLimiter}. Both are released before any backoff delay and re-acquired by the next
 * attempt. Backoff delays are scheduled rather than slept, so a waiting retry occupies no
 * worker thread.</p>
 *
 * <p>A query resolves to the non-empty {@code SuggestedAddress} array of the response, or to
 * {@link Optional#empty()} when the service has no suggestions. {@link #fetch(String)} also maps
 * a query that ended without an answer to {@link Optional#empty()}; {@link #fetchOrFail(String)}
 * reports it as a {@link FetchFailedException} instead.</p>
 */
public class FetchOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);

    public static final String SUGGESTED_ADDRESS = "SuggestedAddress";
    private static final String STAGE = "fetch";

    private final LookupClient client;
    private final RateLimiter rateLimiter;
    private final FetchOptions options;
    private final MetricsService metrics;
    private final Semaphore inFlight;
    private final ExecutorService workers;

    public FetchOrchestrator(LookupClient client, RateLimiter rateLimiter, FetchOptions options) {
        this(client, rateLimiter, options, new NoOpMetricsService());
    }

    public FetchOrchestrator(LookupClient client, RateLimiter rateLimiter, FetchOptions options,
                             MetricsService metrics) {
        this.client = Objects.requireNonNull(client, "client is required");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter is required");
        this.options = options != null ? options : FetchOptions.defaults();
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.inFlight = new Semaphore(this.options.getMaxInFlight());
        this.workers = Executors.newFixedThreadPool(this.options.getWorkerThreads(), new WorkerThreadFactory());
    }

    /**
     * Fetches the suggestions for one query.
     */
    public CompletableFuture<Optional<ArrayNode>> fetch(String query) {
        return fetchOrFail(query).exceptionally(e -> Optional.empty());
    }

    /**
     * Fetches the suggestions for one query. The future fails with {@link FetchFailedException}
     * when retries run out or the orchestrator or its rate limiter is closed.
     */
    public CompletableFuture<Optional<ArrayNode>> fetchOrFail(String query) {
        CompletableFuture<Optional<ArrayNode>> result = new CompletableFuture<>();
        attempt(query, 0, result);
        return result;
    }

    /**
     * Fetches all queries concurrently. The result list is aligned with the input list.
     */
    public CompletableFuture<List<Optional<ArrayNode>>> fetchAll(List<String> queries) {
        List<CompletableFuture<Optional<ArrayNode>>> futures = queries.stream()
                .map(this::fetch)
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    /**
     * Synchronous variant of {@link #fetch(String)}.
     */
    public Optional<ArrayNode> fetchNow(String query) {
        try {
            return fetch(query).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("fetch.interrupted stage={} query='{}'", STAGE, query);
            return Optional.empty();
        } catch (ExecutionException e) {
            log.error("fetch.unexpected stage={} query='{}' error={}", STAGE, query, e.getCause().toString());
            return Optional.empty();
        }
    }

    public FetchOptions getOptions() {
        return options;
    }

    /**
     * Free in-flight slots.
     */
    int availableSlots() {
        return inFlight.availablePermits();
    }

    private void attempt(String query, int previousFailures, CompletableFuture<Optional<ArrayNode>> result) {
        CompletableFuture<JsonNode> call;
        try {
            call = CompletableFuture.supplyAsync(() -> callOnce(query), workers);
        } catch (RejectedExecutionException e) {
            log.warn("fetch.rejected stage={} query='{}' reason=orchestrator closed", STAGE, query);
            result.completeExceptionally(new FetchFailedException("orchestrator closed", e));
            return;
        }

        call.whenComplete((body, error) -> {
            if (error == null) {
                result.complete(suggestionsOf(body, query));
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof RateLimiterClosedException) {
                log.warn("fetch.aborted stage={} query='{}' reason={}", STAGE, query, cause.getMessage());
                result.completeExceptionally(new FetchFailedException(cause.getMessage(), cause));
                return;
            }

            int attempt = previousFailures + 1;
            log.warn("fetch.failed stage={} attempt={}/{} query='{}' error={}",
                    STAGE, attempt, options.getMaxRetries(), query, cause.toString());
            metrics.recordFetchFailure(attempt);

            if (attempt >= options.getMaxRetries()) {
                log.error("fetch.exhausted stage={} attempts={} query='{}' lastError={}",
                        STAGE, attempt, query, cause.toString());
                metrics.recordRetryExhausted();
                result.completeExceptionally(new FetchFailedException(
                        "no answer after " + attempt + " attempts", cause));
                return;
            }

            Duration delay = options.backoffAfter(previousFailures);
            log.debug("fetch.retry stage={} attempt={} delayMs={} query='{}'",
                    STAGE, attempt + 1, delay.toMillis(), query);
            CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)
                    .execute(() -> attempt(query, attempt, result));
        });
    }

    private JsonNode callOnce(String query) {
        try {
            inFlight.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(new LookupException("Interrupted waiting for an in-flight slot", e));
        }
        try {
            rateLimiter.acquire();
            long start = System.nanoTime();
            try {
                return client.lookup(query);
            } catch (LookupException e) {
                throw new CompletionException(e);
            } finally {
                metrics.recordLookupDuration(Duration.ofNanos(System.nanoTime() - start));
            }
        } finally {
            inFlight.release();
        }
    }

    private Optional<ArrayNode> suggestionsOf(JsonNode body, String query) {
        JsonNode suggestions = body != null ? body.get(SUGGESTED_ADDRESS) : null;
        if (suggestions instanceof ArrayNode array && !array.isEmpty()) {
            log.debug("fetch.succeeded stage={} query='{}' suggestions={}", STAGE, query, array.size());
            return Optional.of(array);
        }
        log.info("fetch.noSuggestions stage={} query='{}'", STAGE, query);
        return Optional.empty();
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "address-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
