package com.florist.flowerservice.infrastructure.observability;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import javax.sql.DataSource;

/** Borrows a pooled connection and asks the driver whether it is still valid. */
public class DatabaseHealthCheck implements HealthCheck {

    public static final String NAME = "database";

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final Executor executor;

    /** {@code executor} runs the blocking check. */
    public DatabaseHealthCheck(DataSource dataSource, Executor executor) {
        this.dataSource = dataSource;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        return CompletableFuture.supplyAsync(this::runCheck, executor);
    }

    ComponentHealth runCheck() {
        long start = System.nanoTime();
        try (Connection connection = dataSource.getConnection()) {
            if (connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                return ComponentHealth.healthy(NAME, elapsedMs(start));
            }
            return ComponentHealth.unhealthy(NAME, "Connection is not valid", elapsedMs(start));
        } catch (SQLException e) {
            return ComponentHealth.unhealthy(NAME, e.getMessage(), elapsedMs(start));
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
