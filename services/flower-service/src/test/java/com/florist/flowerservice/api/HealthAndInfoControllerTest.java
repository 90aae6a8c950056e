package com.florist.flowerservice.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.florist.database.migration.MigrationService;
import com.florist.database.migration.MigrationService.DatabaseStatus;
import com.florist.flowerservice.infrastructure.observability.ComponentHealth;
import com.florist.flowerservice.infrastructure.observability.HealthCheckRegistry;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({HealthController.class, ServiceInfoController.class})
@DisplayName("Health and info endpoints")
class HealthAndInfoControllerTest {

    @TestConfiguration
    static class Checks {

        @Bean
        HealthCheckRegistry healthCheckRegistry() {
            return new HealthCheckRegistry(1000);
        }
    }

    @Autowired private MockMvc mockMvc;
    @Autowired private HealthCheckRegistry registry;

    @MockBean private MigrationService migrationService;

    @BeforeEach
    void resetChecks() {
        registry.deregister("database");
        registry.deregister("migrations");
    }

    @Test
    @DisplayName("GET /health returns 200 while every check is healthy")
    void healthy() throws Exception {
        registry.register(
                "database",
                () -> CompletableFuture.completedFuture(ComponentHealth.healthy("database", 2)));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.status").value("HEALTHY"))
                .andExpect(jsonPath("$.data.checks.database.status").value("HEALTHY"))
                .andExpect(jsonPath("$.data.checks.database.latency_ms").value(2))
                .andExpect(jsonPath("$.data.timestamp").exists());
    }

    @Test
    @DisplayName("GET /health returns 503 when a check is unhealthy")
    void unhealthy() throws Exception {
        registry.register(
                "database",
                () ->
                        CompletableFuture.completedFuture(
                                ComponentHealth.unhealthy("database", "Connection refused", 5)));

        mockMvc.perform(get("/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.data.status").value("UNHEALTHY"))
                .andExpect(jsonPath("$.data.checks.database.message").value("Connection refused"));
    }

    @Test
    @DisplayName("GET /api/info reports name, environment and schema version")
    void info() throws Exception {
        when(migrationService.status()).thenReturn(new DatabaseStatus("flowers", 2, 0, 0, "2"));

        mockMvc.perform(get("/api/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.name").value("flower-service"))
                .andExpect(jsonPath("$.data.environment").value("development"))
                .andExpect(jsonPath("$.data.schema_version").value("2"))
                .andExpect(jsonPath("$.data.status").value("running"));
    }
}
