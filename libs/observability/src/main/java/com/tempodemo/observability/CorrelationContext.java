package com.tempodemo.observability;

/**
 * Immutable correlation context for a single inbound call.
 * <p>
 * Every request entering a service (gRPC call, external-authorization check, HTTP request)
 * establishes a {@code CorrelationContext}. The values are pushed into SLF4J MDC by
 * {@link CorrelationContextHolder} so that each log line carries them.
 *
 * @param correlationId request identifier, usually Envoy's {@code x-request-id}
 * @param userId        authenticated username once known (nullable)
 * @param traceId       current OpenTelemetry trace ID (nullable if tracing is not active)
 * @param spanId        current OpenTelemetry span ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String userId,
        String traceId,
        String spanId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for trace ID. */
    public static final String MDC_TRACE_ID = "traceId";

    /** MDC key for span ID. */
    public static final String MDC_SPAN_ID = "spanId";

    /**
     * Compact constructor, ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context carrying only the correlation ID.
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /**
     * Returns a copy of this context bound to the given user.
     */
    public CorrelationContext withUserId(String userId) {
        return new CorrelationContext(correlationId, userId, traceId, spanId);
    }

    /**
     * Returns a copy of this context carrying the given trace and span IDs.
     */
    public CorrelationContext withTrace(String traceId, String spanId) {
        return new CorrelationContext(correlationId, userId, traceId, spanId);
    }
}
