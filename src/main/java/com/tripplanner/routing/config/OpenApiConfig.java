package com.tripplanner.routing.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI routePlannerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Route Planner API")
                        .description("Road routes with provider fallback, scenic waypoints and multi-day segmentation")
                        .version("v1")
                        .contact(new Contact()
                                .name("Trip Planner")
                                .email("support@tripplanner.dev"))
                        .license(new License().name("MIT")))
                .servers(List.of(
                        new Server().url("http://localhost:8082").description("Local")))
                .externalDocs(new ExternalDocumentation()
                        .description("Valhalla route API")
                        .url("https://valhalla.github.io/valhalla/api/turn-by-turn/api-reference/")
                );
    }

    @Bean
    public GroupedOpenApi routesGroup() {
        return GroupedOpenApi.builder()
                .group("routes")
                .packagesToScan("com.tripplanner.routing.web")
                .pathsToMatch("/api/routes/**")
                .build();
    }
}
