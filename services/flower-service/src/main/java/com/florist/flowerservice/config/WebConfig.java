package com.florist.flowerservice.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** CORS for the flower API; origins come from {@code florist.service.cors-allowed-origins}. */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final FlowerServiceProperties properties;

    public WebConfig(FlowerServiceProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // allowedOriginPatterns accepts "*", allowedOrigins does not combine it with credentials
        registry.addMapping("/api/**")
                .allowedOriginPatterns(properties.corsAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("X-Correlation-ID")
                .maxAge(3600);
    }
}
