package com.address.resolution.fetch;

/**
 * A query ended without an answer from the lookup service: every attempt failed, or the
 * orchestrator or its rate limiter shut down first. Unlike an answer with no suggestions,
 * this outcome must not be cached.
 */
public class FetchFailedException extends RuntimeException {

    public FetchFailedException(String message) {
        super(message);
    }

    public FetchFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
