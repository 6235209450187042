package com.tempodemo.authservice;

import com.tempodemo.authservice.config.AuthServiceProperties;
import com.tempodemo.authservice.config.TracingProperties;
import com.tempodemo.database.migration.DatabaseProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Auth service: hosts the Envoy external-authorization callback and the demo {@code TestService}
 * on one gRPC port.
 *
 * <p>The datasource and Flyway are wired by {@link
 * com.tempodemo.authservice.config.PersistenceConfig} from {@code tempo.database.*}, so the
 * corresponding Spring Boot auto-configurations are excluded.
 *
 * <ul>
 *   <li>gRPC on {@code grpc.server.port} (4321)
 *   <li>Actuator health and Prometheus endpoints on {@code server.port} (8081)
 *   <li>OTLP trace export to {@code tempo.tracing.endpoint}
 * </ul>
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@EnableConfigurationProperties({
    AuthServiceProperties.class,
    TracingProperties.class,
    DatabaseProperties.class
})
public class AuthServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
        log.info("Auth service started");
    }
}
