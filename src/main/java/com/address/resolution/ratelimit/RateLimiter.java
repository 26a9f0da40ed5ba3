package com.address.resolution.ratelimit;

/**
 * Admission gate bounding the sustained rate of outbound lookup calls.
 */
public interface RateLimiter extends AutoCloseable {

    /**
     * Blocks until the caller may issue one request.
     *
     * @throws RateLimiterClosedException if the limiter is closed before a token is granted,
     *                                    or the waiting thread is interrupted
     */
    void acquire();

    /**
     * Whether the limiter still admits callers.
     */
    boolean isOpen();

    /**
     * Stops the limiter. Callers waiting in {@link #acquire()} fail instead of hanging.
     */
    @Override
    void close();
}
