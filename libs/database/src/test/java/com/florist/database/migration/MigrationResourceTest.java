package com.florist.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Checks that the migration scripts are packaged and carry the expected schema and seed data. */
@DisplayName("Migration SQL resources")
class MigrationResourceTest {

    private static final String V1 = "db/migration/flowers/V1__create_flowers_table.sql";
    private static final String V2 = "db/migration/flowers/V2__flowers_updated_at_trigger.sql";

    private static final Pattern SEED_ROW =
            Pattern.compile(
                    "\\('(550e8400-e29b-41d4-a716-4466554400\\d{2})', '([^']*)', '([^']*)',"
                            + " '[^']*', (-?\\d+(?:\\.\\d+)?), (-?\\d+)\\)");

    @Nested
    @DisplayName("V1__create_flowers_table.sql")
    class CreateFlowersTable {

        @Test
        @DisplayName("creates the flowers table with a guard")
        void createsTableIdempotently() throws IOException {
            String sql = readClasspathResource(V1);

            assertThat(sql).contains("CREATE TABLE IF NOT EXISTS flowers");
            assertThat(sql).contains("id          UUID PRIMARY KEY");
            assertThat(sql).contains("price       DOUBLE PRECISION NOT NULL DEFAULT 0");
            assertThat(sql).contains("stock       INTEGER NOT NULL DEFAULT 0");
        }

        @Test
        @DisplayName("creates the name, color and created_at indexes with guards")
        void createsIndexes() throws IOException {
            String sql = readClasspathResource(V1);

            assertThat(sql)
                    .contains("CREATE INDEX IF NOT EXISTS idx_flowers_name ON flowers (name);")
                    .contains("CREATE INDEX IF NOT EXISTS idx_flowers_color ON flowers (color);")
                    .contains(
                            "CREATE INDEX IF NOT EXISTS idx_flowers_created_at ON flowers"
                                    + " (created_at DESC);");
        }

        @Test
        @DisplayName("seeds ten flowers with non-negative price and stock")
        void seedsTenValidRows() throws IOException {
            String sql = readClasspathResource(V1);
            Matcher matcher = SEED_ROW.matcher(sql);

            int rows = 0;
            while (matcher.find()) {
                rows++;
                assertThat(matcher.group(2)).as("name of %s", matcher.group(1)).isNotBlank();
                assertThat(matcher.group(3)).as("color of %s", matcher.group(1)).isNotBlank();
                assertThat(Double.parseDouble(matcher.group(4))).isGreaterThanOrEqualTo(0);
                assertThat(Integer.parseInt(matcher.group(5))).isGreaterThanOrEqualTo(0);
            }
            assertThat(rows).isEqualTo(10);
        }
    }

    @Nested
    @DisplayName("V2__flowers_updated_at_trigger.sql")
    class UpdatedAtTrigger {

        @Test
        @DisplayName("creates the trigger function and a BEFORE UPDATE trigger")
        void createsTrigger() throws IOException {
            String sql = readClasspathResource(V2);

            assertThat(sql)
                    .containsIgnoringCase("CREATE OR REPLACE FUNCTION update_flowers_updated_at")
                    .containsIgnoringCase("BEFORE UPDATE ON flowers");
        }
    }

    @Test
    @DisplayName("file names follow Flyway's V{n}__{desc}.sql convention")
    void followNamingConvention() {
        Pattern flywayName = Pattern.compile("V\\d+__[a-z_]+\\.sql");

        assertThat(V1.substring(V1.lastIndexOf('/') + 1)).matches(flywayName);
        assertThat(V2.substring(V2.lastIndexOf('/') + 1)).matches(flywayName);
    }

    // ── Helpers ──

    private String readClasspathResource(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as("Resource '%s' must be on the classpath", path).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
