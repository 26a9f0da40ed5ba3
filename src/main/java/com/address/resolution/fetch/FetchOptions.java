package com.address.resolution.fetch;

import java.time.Duration;
import java.util.Objects;

/**
 * Admission and retry settings for {@link FetchOrchestrator}.
 */
public class FetchOptions {

    private static final int DEFAULT_MAX_IN_FLIGHT = 20;
    private static final int DEFAULT_MAX_RETRIES = 10;
    private static final int DEFAULT_SLEEP_MULTIPLIER = 2;
    private static final Duration DEFAULT_BACKOFF_UNIT = Duration.ofSeconds(1);

    private final int maxInFlight;
    private final int maxRetries;
    private final int sleepMultiplier;
    private final Duration backoffUnit;
    private final int workerThreads;

    private FetchOptions(Builder builder) {
        this.maxInFlight = builder.maxInFlight;
        this.maxRetries = builder.maxRetries;
        this.sleepMultiplier = builder.sleepMultiplier;
        this.backoffUnit = builder.backoffUnit;
        this.workerThreads = builder.workerThreads > 0 ? builder.workerThreads : builder.maxInFlight;
    }

    public int getMaxInFlight() {
        return maxInFlight;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getSleepMultiplier() {
        return sleepMultiplier;
    }

    public Duration getBackoffUnit() {
        return backoffUnit;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    /**
     * Delay before the next attempt, given how many attempts have failed before the one
     * that just failed: one unit after the first failure, then {@code sleepMultiplier * n}.
     */
    public Duration backoffAfter(int previousFailures) {
        if (previousFailures < 0) {
            throw new IllegalArgumentException("previousFailures must be >= 0");
        }
        long units = previousFailures == 0 ? 1 : (long) sleepMultiplier * previousFailures;
        return backoffUnit.multipliedBy(units);
    }

    public static FetchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "FetchOptions{maxInFlight=" + maxInFlight +
                ", maxRetries=" + maxRetries +
                ", sleepMultiplier=" + sleepMultiplier +
                ", backoffUnit=" + backoffUnit +
                ", workerThreads=" + workerThreads + '}';
    }

    public static class Builder {
        private int maxInFlight = DEFAULT_MAX_IN_FLIGHT;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private int sleepMultiplier = DEFAULT_SLEEP_MULTIPLIER;
        private Duration backoffUnit = DEFAULT_BACKOFF_UNIT;
        private int workerThreads;

        public Builder maxInFlight(int maxInFlight) {
            if (maxInFlight <= 0) {
                throw new IllegalArgumentException("maxInFlight must be > 0");
            }
            this.maxInFlight = maxInFlight;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries <= 0) {
                throw new IllegalArgumentException("maxRetries must be > 0");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder sleepMultiplier(int sleepMultiplier) {
            if (sleepMultiplier < 0) {
                throw new IllegalArgumentException("sleepMultiplier must be >= 0");
            }
            this.sleepMultiplier = sleepMultiplier;
            return this;
        }

        public Builder backoffUnit(Duration backoffUnit) {
            Objects.requireNonNull(backoffUnit, "backoffUnit is required");
            if (backoffUnit.isNegative()) {
                throw new IllegalArgumentException("backoffUnit must not be negative");
            }
            this.backoffUnit = backoffUnit;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("workerThreads must be > 0");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public FetchOptions build() {
            return new FetchOptions(this);
        }
    }
}
