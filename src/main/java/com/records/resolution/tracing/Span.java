package com.records.resolution.tracing;

/**
 * A unit of work in a distributed trace. Closing the span ends it.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("records.resolve")) {
 *     span.setAttribute("candidateType", "committee");
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
