package com.address.resolution.ratelimit;

/**
 * Rate limiter that admits every caller immediately, for when throttling is disabled.
 */
public class NoOpRateLimiter implements RateLimiter {

    private volatile boolean open = true;

    @Override
    public void acquire() {
        if (!open) {
            throw new RateLimiterClosedException("Rate limiter is closed");
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }
}
