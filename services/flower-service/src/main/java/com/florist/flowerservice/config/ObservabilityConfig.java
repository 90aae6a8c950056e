package com.florist.flowerservice.config;

import com.florist.database.migration.MigrationService;
import com.florist.flowerservice.infrastructure.observability.DatabaseHealthCheck;
import com.florist.flowerservice.infrastructure.observability.FlowerMetrics;
import com.florist.flowerservice.infrastructure.observability.HealthCheckRegistry;
import com.florist.flowerservice.infrastructure.observability.MigrationHealthCheck;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import javax.sql.DataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/** Health checks behind {@code GET /health} and the catalog write counters. */
@Configuration
public class ObservabilityConfig {

    /** Bean name of the pool that runs the blocking health checks. */
    public static final String HEALTH_CHECK_EXECUTOR = "healthCheckExecutor";

    private static final int HEALTH_CHECK_THREADS = 2;

    @Bean(name = HEALTH_CHECK_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService healthCheckExecutor() {
        return Executors.newFixedThreadPool(
                HEALTH_CHECK_THREADS, new CustomizableThreadFactory("health-check-"));
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(
            DataSource dataSource,
            ObjectProvider<MigrationService> migrationService,
            @Qualifier(HEALTH_CHECK_EXECUTOR) ExecutorService healthCheckExecutor) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(
                DatabaseHealthCheck.NAME, new DatabaseHealthCheck(dataSource, healthCheckExecutor));
        // absent when florist.flyway.enabled=false
        migrationService.ifAvailable(
                service ->
                        registry.register(
                                MigrationHealthCheck.NAME,
                                new MigrationHealthCheck(service, healthCheckExecutor)));
        return registry;
    }

    @Bean
    public FlowerMetrics flowerMetrics(
            MeterRegistry meterRegistry, FlowerServiceProperties properties) {
        return new FlowerMetrics(meterRegistry, properties.name());
    }
}
