package com.florist.flowerservice.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer counters for catalog writes, each tagged with the service name.
 *
 * <ul>
 *   <li>{@code flowers.created}
 *   <li>{@code flowers.updated}
 *   <li>{@code flowers.deleted}
 * </ul>
 */
public class FlowerMetrics {

    /** Tag key for the service name. */
    public static final String TAG_SERVICE = "service";

    private final Counter created;
    private final Counter updated;
    private final Counter deleted;

    public FlowerMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.created = counter(registry, serviceName, "flowers.created", "Flowers created");
        this.updated = counter(registry, serviceName, "flowers.updated", "Flowers updated");
        this.deleted = counter(registry, serviceName, "flowers.deleted", "Flowers deleted");
    }

    public void created() {
        created.increment();
    }

    public void updated() {
        updated.increment();
    }

    public void deleted() {
        deleted.increment();
    }

    private static Counter counter(
            MeterRegistry registry, String serviceName, String name, String description) {
        return Counter.builder(name)
                .description(description)
                .tag(TAG_SERVICE, serviceName)
                .register(registry);
    }
}
