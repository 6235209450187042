package com.tempodemo.observability;

import java.time.Duration;

/**
 * Process-wide tracing settings consumed by {@link OpenTelemetryBootstrap}.
 *
 * @param enabled      whether spans are exported at all
 * @param serviceName  value of the {@code service.name} resource attribute
 * @param endpoint     OTLP/gRPC collector endpoint (e.g. {@code http://tempo:4317})
 * @param batchTimeout maximum delay before a batch of spans is exported
 */
public record TracingSettings(
        boolean enabled,
        String serviceName,
        String endpoint,
        Duration batchTimeout
) {

    /** Default collector endpoint. */
    public static final String DEFAULT_ENDPOINT = "http://tempo:4317";

    /** Default batch export delay. */
    public static final Duration DEFAULT_BATCH_TIMEOUT = Duration.ofSeconds(1);

    public TracingSettings {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        if (endpoint == null || endpoint.isBlank()) {
            endpoint = DEFAULT_ENDPOINT;
        }
        if (batchTimeout == null || batchTimeout.isZero() || batchTimeout.isNegative()) {
            batchTimeout = DEFAULT_BATCH_TIMEOUT;
        }
    }

    /**
     * Settings with tracing turned off, for tests and local runs without a collector.
     */
    public static TracingSettings disabled(String serviceName) {
        return new TracingSettings(false, serviceName, null, null);
    }
}
