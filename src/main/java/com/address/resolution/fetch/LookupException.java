package com.address.resolution.fetch;

/**
 * A single lookup attempt failed: network error, non-success status or an unreadable body.
 * Always treated as transient by {@link FetchOrchestrator}.
 */
public class LookupException extends Exception {

    private final int statusCode;

    public LookupException(String message) {
        this(message, -1, null);
    }

    public LookupException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public LookupException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    private LookupException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed response, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
