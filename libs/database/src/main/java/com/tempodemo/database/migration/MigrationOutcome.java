package com.tempodemo.database.migration;

/**
 * Result of one {@link SchemaMigrator#upgrade()} run.
 *
 * @param applied number of migrations applied by this run
 * @param currentVersion schema version after the run, null for an empty schema history
 */
public record MigrationOutcome(int applied, String currentVersion) {

    public boolean upToDate() {
        return applied == 0;
    }
}
