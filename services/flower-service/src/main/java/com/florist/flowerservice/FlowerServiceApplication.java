package com.florist.flowerservice;

import com.florist.flowerservice.config.FlowerServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;

/**
 * Flower catalog service.
 *
 * <p>On startup the flowers schema is migrated ({@code com.florist.database}), then the REST API
 * is served:
 *
 * <ul>
 *   <li>{@code GET /health}: database and migration checks
 *   <li>{@code /api/flowers}: catalog CRUD with paging, name search and color filter
 *   <li>{@code GET /api/info}: service name, environment and schema version
 *   <li>{@code /openapi}, {@code /swagger-ui.html}: API documentation
 * </ul>
 */
@SpringBootApplication(scanBasePackages = {"com.florist.flowerservice", "com.florist.database"})
@EnableConfigurationProperties(FlowerServiceProperties.class)
public class FlowerServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(FlowerServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(FlowerServiceApplication.class);
        application.addListeners(startupLogger());
        application.run(args);
    }

    static ApplicationListener<ApplicationReadyEvent> startupLogger() {
        return event -> {
            Environment env = event.getApplicationContext().getEnvironment();
            String host = env.getProperty("server.address", "0.0.0.0");
            String port = env.getProperty("local.server.port", env.getProperty("server.port"));
            log.info("Flower service listening on http://{}:{}", host, port);
            log.info("OpenAPI document at http://{}:{}/openapi", host, port);
        };
    }
}
