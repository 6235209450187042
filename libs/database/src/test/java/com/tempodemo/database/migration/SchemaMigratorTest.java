package com.tempodemo.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.MigrationVersion;
import org.flywaydb.core.api.output.MigrateResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link SchemaMigrator} against a mocked {@link Flyway}.
 */
@DisplayName("SchemaMigrator")
class SchemaMigratorTest {

    private Flyway flyway;
    private MigrationInfoService info;
    private SchemaMigrator migrator;

    @BeforeEach
    void setUp() {
        flyway = mock(Flyway.class);
        info = mock(MigrationInfoService.class);
        when(flyway.info()).thenReturn(info);
        migrator = new SchemaMigrator(flyway);
    }

    private static MigrateResult result(int executed, String target) {
        MigrateResult result = mock(MigrateResult.class);
        result.migrationsExecuted = executed;
        result.targetSchemaVersion = target;
        return result;
    }

    private void currentVersionIs(String version) {
        MigrationInfo current = mock(MigrationInfo.class);
        when(current.getVersion()).thenReturn(MigrationVersion.fromVersion(version));
        when(info.current()).thenReturn(current);
    }

    @Test
    @DisplayName("rejects null flyway")
    void rejectsNullFlyway() {
        assertThatThrownBy(() -> new SchemaMigrator(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("upgrade")
    class Upgrade {

        @Test
        @DisplayName("reports applied migrations and the target version")
        void reportsApplied() {
            when(flyway.migrate()).thenReturn(result(2, "1000"));

            MigrationOutcome outcome = migrator.upgrade();

            assertThat(outcome.applied()).isEqualTo(2);
            assertThat(outcome.currentVersion()).isEqualTo("1000");
            assertThat(outcome.upToDate()).isFalse();
        }

        @Test
        @DisplayName("reports up to date with the current version when nothing was applied")
        void reportsUpToDate() {
            when(flyway.migrate()).thenReturn(result(0, null));
            currentVersionIs("1");

            MigrationOutcome outcome = migrator.upgrade();

            assertThat(outcome.upToDate()).isTrue();
            assertThat(outcome.currentVersion()).isEqualTo("1");
        }

        @Test
        @DisplayName("propagates migration failures")
        void propagatesFailure() {
            when(flyway.migrate()).thenThrow(new FlywayException("Validate failed"));

            assertThatThrownBy(migrator::upgrade)
                    .isInstanceOf(FlywayException.class)
                    .hasMessageContaining("Validate failed");
        }
    }

    @Nested
    @DisplayName("status")
    class Status {

        @Test
        @DisplayName("current version is null for an empty history")
        void emptyHistory() {
            when(info.current()).thenReturn(null);

            assertThat(migrator.currentVersion()).isNull();
        }
    }
}
