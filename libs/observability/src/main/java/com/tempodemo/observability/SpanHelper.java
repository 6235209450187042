package com.tempodemo.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs a unit of work inside its own span, tagged with the request's correlation id and user.
 * <p>
 * Only the OTel API is used here; the SDK comes from {@link OpenTelemetryBootstrap}.
 */
public final class SpanHelper {

    static final String CORRELATION_ID_ATTRIBUTE = "correlation.id";
    static final String USER_ID_ATTRIBUTE = "user.id";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} in a new span that is current for its duration.
     * <p>
     * A thrown {@link RuntimeException} marks the span as failed and propagates unchanged, so a
     * gRPC {@code StatusRuntimeException} keeps its status.
     *
     * @param spanName   span name, e.g. {@code "SELECT users"}
     * @param kind       span kind
     * @param attributes string attributes set before the span starts
     * @param work       the traced work
     * @return whatever {@code work} returns
     */
    public <T> T traced(String spanName, SpanKind kind, Map<String, String> attributes, Supplier<T> work) {
        SpanBuilder builder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();
        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(CORRELATION_ID_ATTRIBUTE, ctx.correlationId());
            if (ctx.userId() != null) {
                span.setAttribute(USER_ID_ATTRIBUTE, ctx.userId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
