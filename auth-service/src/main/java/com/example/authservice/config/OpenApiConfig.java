package com.example.authservice.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * OpenAPI document for the auth endpoints.
 * Token lifetimes in the description come from AuthProperties, so the docs follow the deployment.
 */
@Configuration
public class OpenApiConfig {

    public static final String BEARER_SCHEME = "Bearer Authentication";
    public static final String AUTH_TAG = "Authentication";

    @Bean
    public OpenAPI authServiceOpenAPI(AuthProperties properties) {
        Duration accessTtl = properties.jwt().accessTokenTtl();
        Duration refreshTtl = properties.refreshTokenTtl();

        return new OpenAPI()
                .info(new Info()
                        .title("GeoQuiz Auth Service API")
                        .version("1.0")
                        .description("Accounts and sessions for GeoQuiz players. "
                                + "register and login return an HS256 access token valid for "
                                + accessTtl.toMinutes() + " minutes and an opaque refresh token valid for "
                                + refreshTtl.toDays() + " days. "
                                + "Each refresh token can be exchanged once via /api/auth/refresh; "
                                + "a replayed token is rejected. "
                                + "Errors use application/problem+json with kind, status, traceId and a field map "
                                + "for validation failures."))
                .addTagsItem(new Tag()
                        .name(AUTH_TAG)
                        .description("Registration, login, token rotation, logout and profile"))
                .components(new Components()
                        .addSecuritySchemes(BEARER_SCHEME,
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("Access token from register, login or refresh. "
                                                + "Refresh tokens are not accepted here.")));
    }
}
