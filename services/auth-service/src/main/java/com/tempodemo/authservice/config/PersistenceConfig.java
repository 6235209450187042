package com.tempodemo.authservice.config;

import com.tempodemo.authservice.domain.UserStore;
import com.tempodemo.authservice.infrastructure.persistence.JdbcUserStore;
import com.tempodemo.database.migration.DatabaseProperties;
import com.tempodemo.database.migration.SchemaMigrator;
import com.tempodemo.observability.SpanHelper;
import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Connection pool, schema migration and the JDBC credential store.
 *
 * <p>Active unless {@code tempo.database.enabled=false}. The migrator bean runs {@link
 * SchemaMigrator#upgrade()} as its init method and the store depends on it, so a failed migration
 * aborts startup before the gRPC server accepts calls.
 */
@Configuration
@ConditionalOnProperty(
        prefix = "tempo.database",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true)
public class PersistenceConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(DatabaseProperties properties) {
        HikariDataSource dataSource =
                DataSourceBuilder.create()
                        .type(HikariDataSource.class)
                        .url(properties.url())
                        .username(properties.username())
                        .password(properties.password())
                        .build();
        dataSource.setPoolName("tempo-users");
        dataSource.setMaximumPoolSize(properties.maximumPoolSize());
        dataSource.setConnectionTimeout(properties.connectionTimeout().toMillis());
        return dataSource;
    }

    @Bean(initMethod = "upgrade")
    public SchemaMigrator schemaMigrator(DataSource dataSource, DatabaseProperties properties) {
        return SchemaMigrator.create(dataSource, properties);
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    @DependsOn("schemaMigrator")
    public UserStore userStore(JdbcTemplate jdbcTemplate, SpanHelper spanHelper) {
        return new JdbcUserStore(jdbcTemplate, spanHelper);
    }
}
