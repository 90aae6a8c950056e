package com.florist.flowerservice.infrastructure.observability;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate of all registered health checks.
 *
 * @param status worst status among the checks
 * @param checks per-component results, in registration order
 * @param timestamp when the checks ran
 */
public record HealthResult(
        HealthStatus status, Map<String, ComponentHealth> checks, Instant timestamp) {

    public HealthResult {
        checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }

    /** False only when some component is {@link HealthStatus#UNHEALTHY}. */
    @JsonIgnore
    public boolean isHealthy() {
        return status != HealthStatus.UNHEALTHY;
    }
}
