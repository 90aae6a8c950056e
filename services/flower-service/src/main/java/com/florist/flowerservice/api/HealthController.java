package com.florist.flowerservice.api;

import com.florist.flowerservice.application.dto.ApiResponse;
import com.florist.flowerservice.infrastructure.observability.HealthCheckRegistry;
import com.florist.flowerservice.infrastructure.observability.HealthResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** {@code GET /health}: 200 while the service can serve requests, 503 otherwise. */
@RestController
@Tag(name = "Health")
public class HealthController {

    private final HealthCheckRegistry healthCheckRegistry;

    public HealthController(HealthCheckRegistry healthCheckRegistry) {
        this.healthCheckRegistry = healthCheckRegistry;
    }

    @GetMapping("/health")
    @Operation(summary = "Service health")
    public ResponseEntity<ApiResponse<HealthResult>> health() {
        HealthResult result = healthCheckRegistry.checkAll();
        HttpStatus status = result.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status)
                .body(new ApiResponse<>(result.isHealthy(), result, null));
    }
}
