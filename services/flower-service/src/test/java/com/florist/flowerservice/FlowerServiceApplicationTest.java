package com.florist.flowerservice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.florist.database.migration.MigrationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Full application against a real PostgreSQL: migration at startup, then the HTTP API over the
 * seeded catalog. Skipped when no Docker daemon is available.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Flower service (PostgreSQL)")
class FlowerServiceApplicationTest {

    private static final String SEED_ID_PREFIX = "550e8400-e29b-41d4-a716-4466554400";

    @Container
    private static final PostgreSQLContainer<?> POSTGRES =
            new PostgreSQLContainer<>("postgres:15-alpine");

    @DynamicPropertySource
    static void datasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired private MockMvc mockMvc;
    @Autowired private JdbcTemplate jdbc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private MigrationService migrationService;

    @BeforeEach
    void keepOnlySeedRows() {
        jdbc.update("DELETE FROM flowers WHERE id::text NOT LIKE ?", SEED_ID_PREFIX + "%");
    }

    @Test
    @DisplayName("migrates the schema at startup")
    void migratesAtStartup() {
        assertThat(migrationService.status().upToDate()).isTrue();
        assertThat(migrationService.status().currentVersion()).isEqualTo("2");
    }

    @Test
    @DisplayName("lists the ten seed flowers newest first")
    void listsSeedFlowers() throws Exception {
        mockMvc.perform(get("/api/flowers").param("per_page", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value(10))
                .andExpect(jsonPath("$.data.total_pages").value(4))
                .andExpect(
                        jsonPath(
                                "$.data.data[*].name",
                                contains("Hydrangea", "Carnation", "Daisy")));

        mockMvc.perform(get("/api/flowers").param("page", "4").param("per_page", "3"))
                .andExpect(jsonPath("$.data.data[*].name", contains("Rose")));
    }

    @Test
    @DisplayName("filters by color and searches names case-insensitively")
    void filtersAndSearches() throws Exception {
        mockMvc.perform(get("/api/flowers").param("color", "WHITE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value(3))
                .andExpect(
                        jsonPath(
                                "$.data.data[*].name",
                                containsInAnyOrder("Lily", "Jasmine", "Daisy")));

        mockMvc.perform(get("/api/flowers").param("search", "SUN"))
                .andExpect(jsonPath("$.data.data[*].name", contains("Sunflower")));

        mockMvc.perform(get("/api/flowers").param("search", "%"))
                .andExpect(jsonPath("$.data.total").value(0));
    }

    @Test
    @DisplayName("creates, reads, updates and deletes a flower")
    void crudLifecycle() throws Exception {
        String body =
                mockMvc.perform(
                                post("/api/flowers")
                                        .contentType(MediaType.APPLICATION_JSON)
                                        .content(
                                                """
                                                {"name": " Peony ", "color": "Pink", "price": 40000}
                                                """))
                        .andExpect(status().isCreated())
                        .andExpect(jsonPath("$.data.name").value("Peony"))
                        .andExpect(jsonPath("$.data.color").value("pink"))
                        .andExpect(jsonPath("$.data.stock").value(0))
                        .andReturn()
                        .getResponse()
                        .getContentAsString();
        JsonNode created = objectMapper.readTree(body).path("data");
        String id = created.path("id").asText();

        mockMvc.perform(get("/api/flowers/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.price").value(40000.0));

        mockMvc.perform(
                        put("/api/flowers/{id}", id)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"stock\": 15, \"description\": \"Fluffy\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("Peony"))
                .andExpect(jsonPath("$.data.stock").value(15))
                .andExpect(jsonPath("$.data.description").value("Fluffy"));

        mockMvc.perform(delete("/api/flowers/{id}", id)).andExpect(status().isNoContent());
        mockMvc.perform(get("/api/flowers/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Flower not found with id: " + id));
    }

    @Test
    @DisplayName("reports healthy database and migrations")
    void health() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.checks.database.status").value("HEALTHY"))
                .andExpect(jsonPath("$.data.checks.migrations.status").value("HEALTHY"));
    }

    @Test
    @DisplayName("serves the OpenAPI document")
    void openApi() throws Exception {
        mockMvc.perform(get("/openapi"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info.title").value("Flower Catalog API"));
    }
}
