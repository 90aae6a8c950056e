package com.florist.flowerservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.florist.flowerservice.domain.shared.Pagination;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FlowerServiceProperties")
class FlowerServicePropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props =
                new FlowerServiceProperties(
                        "flower-service",
                        "production",
                        "Catalog",
                        20,
                        50,
                        List.of("https://shop.example.com"));

        assertThat(props.name()).isEqualTo("flower-service");
        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.defaultPageSize()).isEqualTo(20);
        assertThat(props.maxPageSize()).isEqualTo(50);
        assertThat(props.corsAllowedOrigins()).containsExactly("https://shop.example.com");
    }

    @Test
    @DisplayName("fills defaults for unset values")
    void fillsDefaults() {
        var props = new FlowerServiceProperties("flower-service", null, null, 0, 0, null);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.defaultPageSize()).isEqualTo(Pagination.DEFAULT_PER_PAGE).isEqualTo(10);
        assertThat(props.maxPageSize()).isEqualTo(Pagination.DEFAULT_MAX_PER_PAGE).isEqualTo(100);
        assertThat(props.corsAllowedOrigins()).containsExactly("*");
    }

    @Test
    @DisplayName("caps the default page size at the maximum")
    void capsDefaultPageSize() {
        var props = new FlowerServiceProperties("flower-service", "dev", null, 50, 20, List.of());

        assertThat(props.defaultPageSize()).isEqualTo(20);
    }
}
