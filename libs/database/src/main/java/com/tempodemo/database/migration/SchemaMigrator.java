package com.tempodemo.database.migration;

import java.util.List;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings the credential schema up to date.
 *
 * <p>This is a POJO (no Spring annotations) so it can be driven from unit tests with a mocked
 * {@link Flyway}. Services call {@link #upgrade()} once during startup, before they accept traffic;
 * a {@link FlywayException} is left to propagate so the process fails to start.
 */
public class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    private final Flyway flyway;

    public SchemaMigrator(Flyway flyway) {
        if (flyway == null) {
            throw new IllegalArgumentException("flyway must not be null");
        }
        this.flyway = flyway;
    }

    /**
     * Creates a migrator for the given pool using the configured locations.
     *
     * @param dataSource pooled connection source (shared with the runtime queries)
     * @param properties externalized database settings
     */
    public static SchemaMigrator create(DataSource dataSource, DatabaseProperties properties) {
        List<String> locations = properties.locations();
        Flyway flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations(locations.toArray(String[]::new))
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
        return new SchemaMigrator(flyway);
    }

    /**
     * Applies every pending migration.
     *
     * @return how many migrations were applied and the resulting schema version
     * @throws FlywayException if a migration fails or the history is inconsistent
     */
    public MigrationOutcome upgrade() {
        MigrateResult result = flyway.migrate();
        String version = result.targetSchemaVersion != null ? result.targetSchemaVersion : currentVersion();
        var outcome = new MigrationOutcome(result.migrationsExecuted, version);
        if (outcome.upToDate()) {
            log.info("database is up to date (version={})", outcome.currentVersion());
        } else {
            log.info("all migrations applied successfully (applied={}, version={})",
                    outcome.applied(), outcome.currentVersion());
        }
        return outcome;
    }

    /** Version of the latest applied migration, or null when nothing has been applied. */
    public String currentVersion() {
        MigrationInfo current = flyway.info().current();
        return current == null || current.getVersion() == null ? null : current.getVersion().getVersion();
    }
}
