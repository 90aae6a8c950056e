package com.florist.database.migration;

import java.util.Arrays;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.MigrationVersion;

/**
 * Reports migration state for one database by reading Flyway's info service.
 *
 * <p>Plain class with no Spring annotations; {@link FlywayMigrationConfig} wires it for the
 * service, tests construct it directly.
 */
public class MigrationService {

    /**
     * One migration known to Flyway, applied or not.
     *
     * @param version migration version (e.g. "1"), null for repeatable migrations
     * @param description migration description (e.g. "create flowers table")
     * @param state Flyway state name (e.g. "SUCCESS", "PENDING", "FAILED")
     * @param installedOn ISO-8601 install time, null while pending
     */
    public record MigrationInfo(
            String version, String description, String state, String installedOn) {}

    /**
     * Aggregate migration state of a database.
     *
     * @param database logical database name (e.g. "flowers")
     * @param appliedMigrations number of successfully applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param failedMigrations number of migrations recorded as failed
     * @param currentVersion current schema version, null if nothing has been applied
     */
    public record DatabaseStatus(
            String database,
            int appliedMigrations,
            int pendingMigrations,
            int failedMigrations,
            String currentVersion) {

        /** True when nothing is pending and nothing has failed. */
        public boolean upToDate() {
            return pendingMigrations == 0 && failedMigrations == 0;
        }
    }

    private final String database;
    private final Flyway flyway;

    public MigrationService(String database, Flyway flyway) {
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("database must not be null or blank");
        }
        if (flyway == null) {
            throw new IllegalArgumentException("flyway must not be null");
        }
        this.database = database;
        this.flyway = flyway;
    }

    /** Returns the current migration status of the database. */
    public DatabaseStatus status() {
        MigrationInfoService info = flyway.info();
        org.flywaydb.core.api.MigrationInfo[] all = info.all();

        int applied =
                (int)
                        Arrays.stream(all)
                                .filter(m -> m.getState().isApplied() && !m.getState().isFailed())
                                .count();
        int failed = (int) Arrays.stream(all).filter(m -> m.getState().isFailed()).count();
        int pending = info.pending().length;

        org.flywaydb.core.api.MigrationInfo current = info.current();
        String currentVersion = current != null ? versionOf(current.getVersion()) : null;

        return new DatabaseStatus(database, applied, pending, failed, currentVersion);
    }

    /** Returns every migration Flyway knows about, in version order. */
    public List<MigrationInfo> migrations() {
        return Arrays.stream(flyway.info().all()).map(MigrationService::toInfo).toList();
    }

    public String database() {
        return database;
    }

    private static MigrationInfo toInfo(org.flywaydb.core.api.MigrationInfo migration) {
        return new MigrationInfo(
                versionOf(migration.getVersion()),
                migration.getDescription(),
                migration.getState().name(),
                migration.getInstalledOn() != null
                        ? migration.getInstalledOn().toInstant().toString()
                        : null);
    }

    private static String versionOf(MigrationVersion version) {
        return version != null ? version.getVersion() : null;
    }
}
