package com.trace.export.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forUpload(batchId, "checkout")) {
 *     log.debug("batch.uploaded spans={}", batch.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one batch upload.
     */
    public static LogContext forUpload(String batchId, String serviceName) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("serviceName", serviceName);
        ctx.put("operation", "upload");
        return ctx;
    }

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
