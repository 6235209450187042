package com.tempodemo.echoservice.config;

import com.tempodemo.observability.OpenTelemetryBootstrap;
import com.tempodemo.observability.SensitiveDataRedactor;
import io.opentelemetry.instrumentation.spring.webmvc.v6_0.SpringWebMvcTelemetry;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import jakarta.servlet.Filter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/** Tracing SDK, the OpenTelemetry server-span filter and the header redactor. */
@Configuration
public class ObservabilityConfig {

    @Bean(destroyMethod = "close")
    public OpenTelemetrySdk openTelemetry(EchoServiceProperties properties) {
        return OpenTelemetryBootstrap.create(properties.tracingSettings());
    }

    @Bean
    public FilterRegistrationBean<Filter> tracingFilter(OpenTelemetrySdk openTelemetry) {
        var registration =
                new FilterRegistrationBean<>(SpringWebMvcTelemetry.create(openTelemetry).createServletFilter());
        // before the correlation filter so the trace id is available to it
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registration;
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }
}
