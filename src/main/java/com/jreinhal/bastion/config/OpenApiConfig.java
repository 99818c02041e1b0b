package com.jreinhal.bastion.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation at /swagger-ui.html. Served only where {@code springdoc.api-docs.enabled}
 * is true (the dev profile).
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name:bastion}")
    private String appName;

    @Bean
    public OpenAPI bastionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Bastion Chat Gateway API")
                        .description("""
                                Hardened retrieval-augmented chat gateway.

                                Every request under /api/v1 except /health needs an `X-API-Key` header.
                                Requests are limited per minute and per day; exceeded limits answer 429
                                with a `Retry-After` header.
                                """)
                        .version("1.0.0"))
                .components(new Components()
                        .addSecuritySchemes("apiKey", new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-API-Key")
                                .description("Shared API key issued to the front end")))
                .security(List.of(new SecurityRequirement().addList("apiKey")))
                .tags(List.of(
                        new Tag().name("Chat").description("Question answering, bulk and streaming"),
                        new Tag().name("System").description("Health and usage for " + this.appName)));
    }
}
