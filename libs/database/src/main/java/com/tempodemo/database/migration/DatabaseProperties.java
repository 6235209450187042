package com.tempodemo.database.migration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection pool and migration settings for the credential database.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * tempo:
 *   database:
 *     url: jdbc:postgresql://postgres:5432/test
 *     username: test
 *     password: test
 *     locations:
 *       - classpath:db/migration
 *       - classpath:db/seed/development
 * }</pre>
 *
 * @param enabled whether the service connects to the database at all (tests switch it off)
 * @param url JDBC connection URL
 * @param username database username
 * @param password database password
 * @param locations Flyway migration locations, applied in version order across all of them
 * @param maximumPoolSize upper bound of the HikariCP pool
 * @param connectionTimeout how long a caller waits for a pooled connection
 */
@Validated
@ConfigurationProperties(prefix = "tempo.database")
public record DatabaseProperties(
        Boolean enabled,
        @NotBlank String url,
        @NotBlank String username,
        String password,
        @NotEmpty List<String> locations,
        @Min(1) Integer maximumPoolSize,
        Duration connectionTimeout) {

    public static final String DEFAULT_URL = "jdbc:postgresql://postgres:5432/test";
    public static final String DEFAULT_LOCATION = "classpath:db/migration";
    public static final String DEVELOPMENT_SEED_LOCATION = "classpath:db/seed/development";

    public DatabaseProperties {
        if (enabled == null) {
            enabled = true;
        }
        if (url == null || url.isBlank()) {
            url = DEFAULT_URL;
        }
        if (username == null || username.isBlank()) {
            username = "test";
        }
        if (password == null) {
            password = "test";
        }
        locations = locations == null || locations.isEmpty()
                ? List.of(DEFAULT_LOCATION)
                : List.copyOf(locations);
        if (maximumPoolSize == null) {
            maximumPoolSize = 10;
        }
        if (connectionTimeout == null) {
            connectionTimeout = Duration.ofSeconds(5);
        }
    }

    /** True when the development seed users are part of the migration run. */
    public boolean seedsDevelopmentUsers() {
        return locations.contains(DEVELOPMENT_SEED_LOCATION);
    }

    @Override
    public String toString() {
        return "DatabaseProperties[url=" + url + ", username=" + username + ", locations=" + locations + "]";
    }
}
