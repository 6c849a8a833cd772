package com.bikeway.route.config;

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
    public OpenAPI routeOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Bikeway Route API")
                        .description("Bike-share journey planning: walk and bike legs, round trips and circular courses")
                        .version("v1")
                        .contact(new Contact()
                                .name("Bikeway")
                                .email("support@bikeway.app"))
                        .license(new License().name("MIT")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local environment")));
    }

    @Bean
    public GroupedOpenApi routesGroup() {
        return GroupedOpenApi.builder()
                .group("routes")
                .packagesToScan("com.bikeway.route.web")
                .pathsToMatch("/api/routes/**")
                .build();
    }
}
