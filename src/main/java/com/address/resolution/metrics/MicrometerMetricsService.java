package com.address.resolution.metrics;

import com.address.resolution.core.model.DropReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code address.lookup.duration}: Timer, one sample per lookup attempt</li>
 *   <li>{@code address.fetch.failure}: Counter of transient lookup failures</li>
 *   <li>{@code address.fetch.exhausted}: Counter of addresses that ran out of retries</li>
 *   <li>{@code address.similarity.score}: DistributionSummary of winning scores</li>
 *   <li>{@code address.resolved}: Counter</li>
 *   <li>{@code address.dropped}: Counter (tag: reason)</li>
 *   <li>{@code address.batch.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer lookupTimer;
    private final Counter fetchFailureCounter;
    private final Counter retryExhaustedCounter;
    private final DistributionSummary similarityScoreSummary;
    private final Counter resolvedCounter;
    private final Map<DropReason, Counter> droppedCounters = new EnumMap<>(DropReason.class);
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.lookupTimer = Timer.builder("address.lookup.duration")
                .description("Duration of lookup service calls")
                .register(registry);
        this.fetchFailureCounter = Counter.builder("address.fetch.failure")
                .description("Number of transient lookup failures")
                .register(registry);
        this.retryExhaustedCounter = Counter.builder("address.fetch.exhausted")
                .description("Number of addresses that exhausted their retries")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("address.similarity.score")
                .description("Similarity score of the selected candidate")
                .register(registry);
        this.resolvedCounter = Counter.builder("address.resolved")
                .description("Number of addresses resolved to an output record")
                .register(registry);
        for (DropReason reason : DropReason.values()) {
            droppedCounters.put(reason, Counter.builder("address.dropped")
                    .description("Number of addresses dropped from the output")
                    .tag("reason", reason.name())
                    .register(registry));
        }
        this.batchSizeSummary = DistributionSummary.builder("address.batch.size")
                .description("Number of addresses per batch")
                .register(registry);
    }

    @Override
    public void recordLookupDuration(Duration duration) {
        lookupTimer.record(duration);
    }

    @Override
    public void recordFetchFailure(int attempt) {
        fetchFailureCounter.increment();
    }

    @Override
    public void recordRetryExhausted() {
        retryExhaustedCounter.increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        // Micrometer drops negative samples; penalised-only candidates are counted as zero.
        similarityScoreSummary.record(Math.max(0, score));
    }

    @Override
    public void incrementResolved() {
        resolvedCounter.increment();
    }

    @Override
    public void incrementDropped(DropReason reason) {
        droppedCounters.get(reason).increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }
}
