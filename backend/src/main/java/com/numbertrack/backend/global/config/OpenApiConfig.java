package com.numbertrack.backend.global.config;

import java.util.Set;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;

import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Declares the admin bearer scheme and attaches it to every operation except login and the employee-facing
 * verification endpoints.
 */
@Configuration
public class OpenApiConfig {

    static final String BEARER_SCHEME = "adminBearer";

    private static final Set<String> OPEN_PATHS = Set.of("/auth/login", "/verification/info", "/verification/submit");

    @Bean
    public OpenAPI numberTrackOpenApi() {
        return new OpenAPI()
                .info(new Info().title("NumberTrack API").version("v1")
                        .description("Company mobile number lifecycle and employee verification campaigns"))
                .components(new Components().addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT")));
    }

    @Bean
    public OpenApiCustomizer adminBearerCustomizer() {
        return openApi -> {
            if (openApi.getPaths() == null) {
                return;
            }
            openApi.getPaths().forEach((path, item) -> {
                if (OPEN_PATHS.contains(path)) {
                    return;
                }
                item.readOperations().forEach(operation ->
                        operation.addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME)));
            });
        };
    }
}
