package com.address.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forAddress(batchId, index).with("stage", "score")) {
 *     log.info("address.resolved score={}", score);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String BATCH_ID = "batchId";
    public static final String ADDRESS_INDEX = "addressIndex";
    public static final String STAGE = "stage";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole batch run.
     */
    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put(BATCH_ID, batchId);
        return ctx;
    }

    /**
     * Creates a log context for the resolution of one input address.
     */
    public static LogContext forAddress(String batchId, int addressIndex) {
        LogContext ctx = new LogContext();
        ctx.put(BATCH_ID, batchId);
        ctx.put(ADDRESS_INDEX, Integer.toString(addressIndex));
        return ctx;
    }

    /**
     * Generates a unique batch ID.
     */
    public static String generateBatchId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
