package com.florist.flowerservice.infrastructure.observability;

/**
 * Health of a single component.
 *
 * @param name component name ("database", "migrations")
 * @param status component status
 * @param message detail, usually the failure reason (nullable)
 * @param latencyMs time the check took
 */
public record ComponentHealth(String name, HealthStatus status, String message, long latencyMs) {

    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs);
    }

    public static ComponentHealth healthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, message, latencyMs);
    }

    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs);
    }
}
