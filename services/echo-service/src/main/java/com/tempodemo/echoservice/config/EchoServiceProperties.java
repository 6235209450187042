package com.tempodemo.echoservice.config;

import com.tempodemo.observability.TracingSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Echo service settings, bound from {@code tempo.*}.
 *
 * <pre>
 * tempo:
 *   service:
 *     name: echo-service
 *   tracing:
 *     endpoint: http://tempo:4317
 *   echo:
 *     max-delay: 1900ms
 * </pre>
 *
 * @param service service identity
 * @param tracing OTLP exporter settings
 * @param echo {@code /test} behavior
 */
@ConfigurationProperties(prefix = "tempo")
@Validated
public record EchoServiceProperties(@Valid Service service, Tracing tracing, Echo echo) {

    public EchoServiceProperties {
        if (service == null) {
            service = new Service(null, null);
        }
        if (tracing == null) {
            tracing = new Tracing(null, null, null);
        }
        if (echo == null) {
            echo = new Echo(null);
        }
    }

    /**
     * @param name service name for the tracing resource
     * @param environment deployment environment
     */
    public record Service(@NotBlank String name, String environment) {
        public Service {
            if (name == null || name.isBlank()) {
                name = "echo-service";
            }
            if (environment == null || environment.isBlank()) {
                environment = "local";
            }
        }
    }

    public record Tracing(Boolean enabled, String endpoint, Duration batchTimeout) {
        public Tracing {
            if (enabled == null) {
                enabled = true;
            }
        }
    }

    /**
     * @param maxDelay upper bound of the random pause after answering, in 100 ms steps; zero
     *     disables it
     */
    public record Echo(Duration maxDelay) {
        public static final Duration DEFAULT_MAX_DELAY = Duration.ofMillis(1900);

        public Echo {
            if (maxDelay == null || maxDelay.isNegative()) {
                maxDelay = DEFAULT_MAX_DELAY;
            }
        }
    }

    public TracingSettings tracingSettings() {
        return new TracingSettings(
                tracing.enabled(), service.name(), tracing.endpoint(), tracing.batchTimeout());
    }
}
