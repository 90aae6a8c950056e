package com.florist.flowerservice.infrastructure.observability;

/** Health of one component or of the whole service. */
public enum HealthStatus {

    /** Functioning normally. */
    HEALTHY,

    /** Impaired but still serving requests. */
    DEGRADED,

    /** Cannot serve requests. */
    UNHEALTHY
}
