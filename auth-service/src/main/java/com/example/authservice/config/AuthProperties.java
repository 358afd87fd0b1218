package com.example.authservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Token and credential settings bound from the {@code auth.*} namespace.
 *
 * JWT secret must be at least 32 bytes (HS256). It is read from the JWT_SECRET
 * environment variable in every deployed profile.
 */
@Validated
@ConfigurationProperties(prefix = "auth")
public record AuthProperties(
        @Valid @NotNull Jwt jwt,
        @DefaultValue("7d") Duration refreshTokenTtl,
        @Valid @DefaultValue Password password,
        @Valid @DefaultValue Store store
) {

    public record Jwt(
            @NotBlank String secret,
            @DefaultValue("15m") Duration accessTokenTtl
    ) {
    }

    public record Password(
            @Min(4) @DefaultValue("10") int bcryptStrength
    ) {
    }

    /**
     * readAttempts counts the first call, so 2 means "retry once".
     */
    public record Store(
            @Min(1) @DefaultValue("2") int readAttempts,
            @DefaultValue("50ms") Duration readRetryWait
    ) {
    }
}
