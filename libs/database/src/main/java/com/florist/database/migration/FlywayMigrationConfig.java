package com.florist.database.migration;

import java.util.Arrays;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationInitializer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway configuration for the flowers database.
 *
 * <p>Spring Boot's {@code FlywayAutoConfiguration} is switched off ({@code spring.flyway.enabled:
 * false}) and replaced by the beans below, driven by {@link FlywayConfigProperties}. Migration runs
 * through a {@link FlywayMigrationInitializer}, which Spring Boot's database-initialization
 * ordering recognises: {@code JdbcTemplate} and friends are only created after {@code migrate}
 * returns, so no repository ever sees a missing table.
 *
 * <h2>Bean Names</h2>
 *
 * <ul>
 *   <li>{@link #FLOWERS_FLYWAY_BEAN}: the Flyway instance bound to the application {@code
 *       DataSource}
 *   <li>{@link #FLOWERS_MIGRATION_INITIALIZER_BEAN}: runs {@code migrate} at startup
 * </ul>
 *
 * @see FlywayConfigProperties
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(
        prefix = "florist.flyway",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true)
public class FlywayMigrationConfig {

    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    /** Bean name for the flowers database Flyway instance. */
    public static final String FLOWERS_FLYWAY_BEAN = "flowersFlyway";

    /** Bean name for the startup migration runner. */
    public static final String FLOWERS_MIGRATION_INITIALIZER_BEAN = "flowersFlywayInitializer";

    /** Logical database name reported by {@link MigrationService}. */
    public static final String FLOWERS_DATABASE = "flowers";

    @Bean(name = FLOWERS_FLYWAY_BEAN)
    public Flyway flowersFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        return createFlyway(dataSource, properties);
    }

    @Bean(name = FLOWERS_MIGRATION_INITIALIZER_BEAN)
    public FlywayMigrationInitializer flowersFlywayInitializer(
            @Qualifier(FLOWERS_FLYWAY_BEAN) Flyway flyway) {
        return new FlywayMigrationInitializer(flyway, FlywayMigrationConfig::migrateAndLog);
    }

    @Bean
    public MigrationService migrationService(@Qualifier(FLOWERS_FLYWAY_BEAN) Flyway flyway) {
        return new MigrationService(FLOWERS_DATABASE, flyway);
    }

    // ── Helpers ──

    static Flyway createFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations())
                .table(properties.table())
                .baselineOnMigrate(properties.baselineOnMigrate())
                .cleanDisabled(properties.cleanDisabled())
                .load();
    }

    static MigrateResult migrateAndLog(Flyway flyway) {
        log.info(
                "Running migrations for database '{}' from {}",
                FLOWERS_DATABASE,
                Arrays.toString(flyway.getConfiguration().getLocations()));
        MigrateResult result = flyway.migrate();
        log.info(
                "Migrations completed: {} applied, schema version {} -> {}",
                result.migrationsExecuted,
                result.initialSchemaVersion,
                result.targetSchemaVersion);
        return result;
    }
}
