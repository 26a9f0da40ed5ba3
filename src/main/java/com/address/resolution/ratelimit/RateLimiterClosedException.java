package com.address.resolution.ratelimit;

/**
 * Thrown by {@link RateLimiter#acquire()} when the limiter stops before admitting the caller.
 */
public class RateLimiterClosedException extends RuntimeException {

    public RateLimiterClosedException(String message) {
        super(message);
    }

    public RateLimiterClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
