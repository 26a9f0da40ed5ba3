package com.address.resolution.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Leaky-bucket rate limiter with a background refill thread.
 *
 * <p>The bucket holds at most {@code min(2, floor(rate) + 1)} tokens, so the limiter
 * enforces a steady rate instead of permitting large bursts. The refill thread wakes every
 * {@code max(1 / rate, 0.1)} seconds, converts the elapsed time into tokens and carries the
 * fractional remainder over to the next cycle.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * try (RateLimiter limiter = new LeakyBucketRateLimiter(20)) {
 *     limiter.acquire();
 *     client.lookup(query);
 * }
 * </pre>
 */
public class LeakyBucketRateLimiter implements RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(LeakyBucketRateLimiter.class);

    static final double MIN_SLEEP_SECONDS = 0.1;
    private static final long CLOSE_GRACE_MS = 500;

    private final double rateLimit;
    private final int capacity;
    private final long sleepNanos;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition tokenAvailable = lock.newCondition();
    private int tokens;
    private boolean closed;

    private final Thread filler;

    public LeakyBucketRateLimiter(double rateLimit) {
        if (Double.isNaN(rateLimit) || rateLimit <= 0) {
            throw new IllegalArgumentException("rateLimit must be positive, got " + rateLimit);
        }
        this.rateLimit = rateLimit;
        this.capacity = capacityFor(rateLimit);
        this.sleepNanos = (long) (sleepSecondsFor(rateLimit) * 1_000_000_000L);
        this.tokens = capacity;
        this.filler = new Thread(this::fill, "rate-limiter-filler");
        this.filler.setDaemon(true);
        this.filler.start();
        log.info("ratelimit.started rate={}/s capacity={} refillEvery={}ms",
                rateLimit, capacity, TimeUnit.NANOSECONDS.toMillis(sleepNanos));
    }

    static int capacityFor(double rateLimit) {
        return (int) Math.min(2, Math.floor(rateLimit) + 1);
    }

    static double sleepSecondsFor(double rateLimit) {
        return Math.max(1 / rateLimit, MIN_SLEEP_SECONDS);
    }

    @Override
    public void acquire() {
        lock.lock();
        try {
            while (tokens == 0 && !closed) {
                tokenAvailable.await();
            }
            if (closed) {
                throw new RateLimiterClosedException("Rate limiter closed while waiting for a token");
            }
            tokens--;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RateLimiterClosedException("Interrupted while waiting for a token", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isOpen() {
        lock.lock();
        try {
            return !closed;
        } finally {
            lock.unlock();
        }
    }

    public double getRateLimit() {
        return rateLimit;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Tokens currently in the bucket.
     */
    int availableTokens() {
        lock.lock();
        try {
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            tokenAvailable.signalAll();
        } finally {
            lock.unlock();
        }
        filler.interrupt();
        try {
            filler.join(CLOSE_GRACE_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (filler.isAlive()) {
            log.warn("ratelimit.close.timeout graceMs={}", CLOSE_GRACE_MS);
        } else {
            log.info("ratelimit.closed");
        }
    }

    private void fill() {
        long updatedAt = System.nanoTime();
        double fraction = 0;
        try {
            while (true) {
                lock.lock();
                try {
                    if (closed) {
                        return;
                    }
                    if (tokens < capacity) {
                        long now = System.nanoTime();
                        double increment = rateLimit * ((now - updatedAt) / 1_000_000_000.0);
                        fraction += increment % 1;
                        double extraIncrement = Math.floor(fraction);
                        int toAdd = (int) Math.min(capacity - tokens, Math.floor(increment) + extraIncrement);
                        fraction = fraction % 1;
                        if (toAdd > 0) {
                            tokens += toAdd;
                            tokenAvailable.signalAll();
                        }
                        updatedAt = now;
                    }
                } finally {
                    lock.unlock();
                }
                TimeUnit.NANOSECONDS.sleep(sleepNanos);
            }
        } catch (InterruptedException e) {
            log.debug("ratelimit.filler.interrupted");
        }
    }
}
