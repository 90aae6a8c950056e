package com.florist.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway settings for the flowers database.
 *
 * <pre>{@code
 * florist:
 *   flyway:
 *     enabled: true
 *     locations: classpath:db/migration/flowers
 *     baseline-on-migrate: true
 *     clean-disabled: true
 *     table: flyway_schema_history
 * }</pre>
 *
 * <p>The connection itself is the application's {@code DataSource}; only migration behaviour is
 * configured here. Unset values fall back to the defaults above.
 *
 * @param enabled whether migrations run on startup
 * @param locations Flyway migration locations
 * @param baselineOnMigrate baseline a non-empty schema that has no history table yet
 * @param cleanDisabled refuse {@code flyway clean} (always true outside throwaway databases)
 * @param table name of the schema history table
 */
@Validated
@ConfigurationProperties(prefix = "florist.flyway")
public record FlywayConfigProperties(
        Boolean enabled,
        @NotBlank String locations,
        Boolean baselineOnMigrate,
        Boolean cleanDisabled,
        @NotBlank String table) {

    /** Default location of the flowers migration scripts. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/flowers";

    /** Default Flyway schema history table. */
    public static final String DEFAULT_TABLE = "flyway_schema_history";

    public FlywayConfigProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
        if (baselineOnMigrate == null) {
            baselineOnMigrate = Boolean.TRUE;
        }
        if (cleanDisabled == null) {
            cleanDisabled = Boolean.TRUE;
        }
        if (table == null || table.isBlank()) {
            table = DEFAULT_TABLE;
        }
    }

    /** Settings with every value at its default. */
    public static FlywayConfigProperties defaults() {
        return new FlywayConfigProperties(null, null, null, null, null);
    }
}
