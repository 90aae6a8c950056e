package com.florist.flowerservice.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** OpenAPI document served at {@code /openapi}; Swagger UI at {@code /swagger-ui.html}. */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:3000}")
    private int serverPort;

    @Bean
    public OpenAPI flowerServiceOpenApi(FlowerServiceProperties properties) {
        return new OpenAPI()
                .info(
                        new Info()
                                .title("Flower Catalog API")
                                .description(
                                        properties.description() != null
                                                ? properties.description()
                                                : "CRUD API for the flower catalog")
                                .version("1.0.0"))
                .servers(
                        List.of(
                                new Server()
                                        .url("http://localhost:" + serverPort)
                                        .description("Local Development Server")));
    }
}
