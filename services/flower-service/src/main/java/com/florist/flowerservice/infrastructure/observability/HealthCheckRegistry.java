package com.florist.flowerservice.infrastructure.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs every registered {@link HealthCheck} concurrently and folds the results into one {@link
 * HealthResult}. A check that fails or exceeds the timeout counts as unhealthy.
 */
public final class HealthCheckRegistry {

    /** Default per-check timeout. */
    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private final Map<String, HealthCheck> checks = new LinkedHashMap<>();
    private final long timeoutMs;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS);
    }

    public HealthCheckRegistry(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
    }

    /** Registers a check, replacing any previous check with the same name. */
    public synchronized void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    public synchronized boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    /** Runs all checks. With nothing registered the result is {@link HealthStatus#HEALTHY}. */
    public HealthResult checkAll() {
        Map<String, HealthCheck> snapshot;
        synchronized (this) {
            snapshot = new LinkedHashMap<>(checks);
        }

        Map<String, CompletableFuture<ComponentHealth>> futures = new LinkedHashMap<>();
        snapshot.forEach((name, check) -> futures.put(name, start(name, check)));

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : futures.entrySet()) {
            String name = entry.getKey();
            ComponentHealth result;
            try {
                result = entry.getValue().orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
            } catch (RuntimeException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                result =
                        ComponentHealth.unhealthy(
                                name, "Timeout or error: " + describe(cause), timeoutMs);
            }
            results.put(name, result);
            overall = worse(overall, result.status());
        }

        return new HealthResult(overall, results, Instant.now());
    }

    public synchronized int size() {
        return checks.size();
    }

    private static CompletableFuture<ComponentHealth> start(String name, HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static HealthStatus worse(HealthStatus a, HealthStatus b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
