package com.address.resolution.metrics;

import com.address.resolution.core.model.DropReason;

import java.time.Duration;

/**
 * Interface for recording address resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the pipeline runs
 * without a meter registry.
 */
public interface MetricsService {

    void recordLookupDuration(Duration duration);

    void recordFetchFailure(int attempt);

    void recordRetryExhausted();

    void recordSimilarityScore(double score);

    void incrementResolved();

    void incrementDropped(DropReason reason);

    void recordBatchSize(int size);
}
