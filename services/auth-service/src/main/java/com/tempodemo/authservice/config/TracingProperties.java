package com.tempodemo.authservice.config;

import com.tempodemo.observability.TracingSettings;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * OTLP exporter settings, bound from {@code tempo.tracing.*}.
 *
 * @param enabled export spans at all (false in tests)
 * @param endpoint OTLP/gRPC collector endpoint
 * @param batchTimeout batch span processor schedule delay
 */
@ConfigurationProperties(prefix = "tempo.tracing")
@Validated
public record TracingProperties(Boolean enabled, String endpoint, Duration batchTimeout) {

    public TracingProperties {
        if (enabled == null) {
            enabled = true;
        }
        if (endpoint == null || endpoint.isBlank()) {
            endpoint = TracingSettings.DEFAULT_ENDPOINT;
        }
        if (batchTimeout == null) {
            batchTimeout = TracingSettings.DEFAULT_BATCH_TIMEOUT;
        }
    }

    public TracingSettings toSettings(String serviceName) {
        return new TracingSettings(enabled, serviceName, endpoint, batchTimeout);
    }
}
