package com.florist.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.Location;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;

@DisplayName("FlywayMigrationConfig")
class FlywayMigrationConfigTest {

    @Test
    @DisplayName("bean name constants are stable")
    void beanNameConstants() {
        assertThat(FlywayMigrationConfig.FLOWERS_FLYWAY_BEAN).isEqualTo("flowersFlyway");
        assertThat(FlywayMigrationConfig.FLOWERS_MIGRATION_INITIALIZER_BEAN)
                .isEqualTo("flowersFlywayInitializer");
        assertThat(FlywayMigrationConfig.FLOWERS_DATABASE).isEqualTo("flowers");
    }

    @Test
    @DisplayName("is a Spring configuration switched by florist.flyway.enabled")
    void isConditionalConfiguration() {
        assertThat(FlywayMigrationConfig.class.isAnnotationPresent(Configuration.class)).isTrue();

        ConditionalOnProperty condition =
                FlywayMigrationConfig.class.getAnnotation(ConditionalOnProperty.class);
        assertThat(condition.prefix()).isEqualTo("florist.flyway");
        assertThat(condition.name()).containsExactly("enabled");
        assertThat(condition.matchIfMissing()).isTrue();
    }

    @Test
    @DisplayName("applies configured locations, table and safety flags to Flyway")
    void createsFlywayFromProperties() {
        var props =
                new FlywayConfigProperties(
                        true, "classpath:db/migration/flowers", true, true, "flower_history");

        Flyway flyway = FlywayMigrationConfig.createFlyway(mock(DataSource.class), props);

        assertThat(flyway.getConfiguration().getLocations())
                .extracting(Location::getDescriptor)
                .containsExactly("classpath:db/migration/flowers");
        assertThat(flyway.getConfiguration().getTable()).isEqualTo("flower_history");
        assertThat(flyway.getConfiguration().isBaselineOnMigrate()).isTrue();
        assertThat(flyway.getConfiguration().isCleanDisabled()).isTrue();
    }
}
