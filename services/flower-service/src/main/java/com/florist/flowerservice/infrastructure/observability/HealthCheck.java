package com.florist.flowerservice.infrastructure.observability;

import java.util.concurrent.CompletableFuture;

/**
 * A lightweight check of one dependency. {@link HealthCheckRegistry} runs all checks concurrently.
 */
@FunctionalInterface
public interface HealthCheck {

    CompletableFuture<ComponentHealth> check();
}
