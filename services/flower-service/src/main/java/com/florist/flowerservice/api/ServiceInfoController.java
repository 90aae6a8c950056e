package com.florist.flowerservice.api;

import com.florist.database.migration.MigrationService;
import com.florist.flowerservice.application.dto.ApiResponse;
import com.florist.flowerservice.config.FlowerServiceProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Runtime information about this instance. */
@RestController
@RequestMapping("/api")
@Tag(name = "Info")
public class ServiceInfoController {

    private final FlowerServiceProperties properties;
    private final ObjectProvider<MigrationService> migrationService;

    public ServiceInfoController(
            FlowerServiceProperties properties, ObjectProvider<MigrationService> migrationService) {
        this.properties = properties;
        this.migrationService = migrationService;
    }

    @GetMapping("/info")
    @Operation(summary = "Service name, environment and schema version")
    public ApiResponse<Map<String, Object>> serviceInfo() {
        // LinkedHashMap: schemaVersion may be null
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("description", properties.description() != null ? properties.description() : "");
        info.put("schema_version", schemaVersion());
        info.put("status", "running");
        info.put("timestamp", Instant.now().toString());
        return ApiResponse.success(info);
    }

    private String schemaVersion() {
        MigrationService service = migrationService.getIfAvailable();
        return service != null ? service.status().currentVersion() : null;
    }
}
