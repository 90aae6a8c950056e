package com.florist.flowerservice.infrastructure.observability;

import com.florist.database.migration.MigrationService;
import com.florist.database.migration.MigrationService.DatabaseStatus;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/** Healthy when the flowers schema has no failed and no pending migrations. */
public class MigrationHealthCheck implements HealthCheck {

    public static final String NAME = "migrations";

    private final MigrationService migrationService;
    private final Executor executor;

    /** {@code executor} runs the blocking check. */
    public MigrationHealthCheck(MigrationService migrationService, Executor executor) {
        this.migrationService = migrationService;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        return CompletableFuture.supplyAsync(this::runCheck, executor);
    }

    ComponentHealth runCheck() {
        long start = System.nanoTime();
        DatabaseStatus status = migrationService.status();
        long latencyMs = (System.nanoTime() - start) / 1_000_000;

        if (status.failedMigrations() > 0) {
            return ComponentHealth.unhealthy(
                    NAME, status.failedMigrations() + " failed migration(s)", latencyMs);
        }
        if (status.pendingMigrations() > 0) {
            return ComponentHealth.unhealthy(
                    NAME, status.pendingMigrations() + " pending migration(s)", latencyMs);
        }
        return ComponentHealth.healthy(NAME, "schema version " + status.currentVersion(), latencyMs);
    }
}
