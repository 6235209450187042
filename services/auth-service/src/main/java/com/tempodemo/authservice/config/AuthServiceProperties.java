package com.tempodemo.authservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe service identity, bound from {@code tempo.service.*}.
 *
 * <pre>
 * tempo:
 *   service:
 *     name: auth-service
 *     environment: docker
 * </pre>
 *
 * @param name service name used for the tracing resource and the metric {@code service} tag
 * @param environment deployment environment (local, docker, test)
 */
@ConfigurationProperties(prefix = "tempo.service")
@Validated
public record AuthServiceProperties(@NotBlank String name, String environment) {

    /** Compact constructor, runs before Bean Validation so defaults satisfy constraints. */
    public AuthServiceProperties {
        if (name == null || name.isBlank()) {
            name = "auth-service";
        }
        if (environment == null || environment.isBlank()) {
            environment = "local";
        }
    }
}
