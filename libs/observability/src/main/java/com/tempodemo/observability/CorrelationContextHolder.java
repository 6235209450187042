package com.tempodemo.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Per-thread {@link CorrelationContext}, mirrored into the SLF4J MDC keys the log pattern reads.
 * <p>
 * grpc-java may run the callbacks of one call on different executor threads, so callers bind the
 * context around each callback and {@link #clear()} it afterwards.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private static final String[] MDC_KEYS = {
            CorrelationContext.MDC_CORRELATION_ID,
            CorrelationContext.MDC_USER_ID,
            CorrelationContext.MDC_TRACE_ID,
            CorrelationContext.MDC_SPAN_ID
    };

    private CorrelationContextHolder() {
    }

    /**
     * Binds {@code context} to this thread, replacing any previous one.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        String[] values = {context.correlationId(), context.userId(), context.traceId(), context.spanId()};
        for (int i = 0; i < MDC_KEYS.length; i++) {
            if (values[i] != null) {
                MDC.put(MDC_KEYS[i], values[i]);
            } else {
                MDC.remove(MDC_KEYS[i]);
            }
        }
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Records the authenticated username on the bound context. Does nothing when no context is bound.
     */
    public static void bindUser(String userId) {
        get().ifPresent(ctx -> set(ctx.withUserId(userId)));
    }

    public static void clear() {
        CONTEXT.remove();
        for (String key : MDC_KEYS) {
            MDC.remove(key);
        }
    }
}
