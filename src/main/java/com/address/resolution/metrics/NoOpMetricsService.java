package com.address.resolution.metrics;

import com.address.resolution.core.model.DropReason;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordLookupDuration(Duration duration) {
    }

    @Override
    public void recordFetchFailure(int attempt) {
    }

    @Override
    public void recordRetryExhausted() {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void incrementResolved() {
    }

    @Override
    public void incrementDropped(DropReason reason) {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
