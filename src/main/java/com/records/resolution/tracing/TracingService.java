package com.records.resolution.tracing;

import java.util.Map;

/**
 * Interface for distributed tracing integration.
 * The default {@link NoOpTracingService} does nothing, so the library works without a tracer.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
