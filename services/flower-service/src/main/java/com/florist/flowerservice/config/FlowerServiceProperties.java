package com.florist.flowerservice.config;

import com.florist.flowerservice.domain.shared.Pagination;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service settings bound from {@code florist.service.*}.
 *
 * <pre>
 * florist:
 *   service:
 *     name: flower-service
 *     environment: production
 *     description: Flower catalog REST API
 *     default-page-size: 10
 *     max-page-size: 100
 *     cors-allowed-origins: https://shop.example.com
 * </pre>
 *
 * @param name service name used in logs, metric tags and {@code /api/info}. Required.
 * @param environment deployment environment (default {@code development})
 * @param description human-readable description
 * @param defaultPageSize {@code per_page} used when the client sends none (default 10)
 * @param maxPageSize largest {@code per_page} accepted (default 100)
 * @param corsAllowedOrigins origins allowed to call {@code /api/**} (default any)
 */
@ConfigurationProperties(prefix = "florist.service")
@Validated
public record FlowerServiceProperties(
        @NotBlank String name,
        String environment,
        String description,
        int defaultPageSize,
        int maxPageSize,
        List<String> corsAllowedOrigins) {

    public FlowerServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (maxPageSize <= 0) {
            maxPageSize = Pagination.DEFAULT_MAX_PER_PAGE;
        }
        if (defaultPageSize <= 0) {
            defaultPageSize = Pagination.DEFAULT_PER_PAGE;
        }
        if (defaultPageSize > maxPageSize) {
            defaultPageSize = maxPageSize;
        }
        if (corsAllowedOrigins == null || corsAllowedOrigins.isEmpty()) {
            corsAllowedOrigins = List.of("*");
        } else {
            corsAllowedOrigins = List.copyOf(corsAllowedOrigins);
        }
    }
}
