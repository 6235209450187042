package com.tempodemo.authservice.config;

import com.tempodemo.observability.MetricFactory;
import com.tempodemo.observability.OpenTelemetryBootstrap;
import com.tempodemo.observability.SensitiveDataRedactor;
import com.tempodemo.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process-wide tracing and metrics helpers.
 *
 * <p>The SDK is injected by reference and never registered globally; Spring closes it once on
 * shutdown, which flushes the batch span processor.
 */
@Configuration
public class ObservabilityConfig {

    static final String INSTRUMENTATION_SCOPE = "com.tempodemo.authservice";

    @Bean(destroyMethod = "close")
    public OpenTelemetrySdk openTelemetry(AuthServiceProperties service, TracingProperties tracing) {
        return OpenTelemetryBootstrap.create(tracing.toSettings(service.name()));
    }

    @Bean
    public SpanHelper spanHelper(OpenTelemetrySdk openTelemetry) {
        return new SpanHelper(openTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, AuthServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }
}
