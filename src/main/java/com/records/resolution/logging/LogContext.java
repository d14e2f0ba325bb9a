package com.records.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(correlationId, "committee", "fec")) {
 *     log.info("entity.resolved entityId={} matchedBy={}", entityId, method);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for resolving one candidate.
     */
    public static LogContext forResolution(String correlationId, String candidateType, String source) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put("candidateType", candidateType);
        ctx.put("source", source);
        ctx.put(OPERATION, "resolve");
        return ctx;
    }

    public static LogContext forMerge(String correlationId, String primaryId, String duplicateId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put("primaryEntityId", primaryId);
        ctx.put("duplicateEntityId", duplicateId);
        ctx.put(OPERATION, "merge");
        return ctx;
    }

    public static LogContext forDuplicateScan(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(OPERATION, "findDuplicates");
        return ctx;
    }

    public static String generateCorrelationId() {
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
        if (value == null) {
            return;
        }
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
