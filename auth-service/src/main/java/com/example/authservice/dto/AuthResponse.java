package com.example.authservice.dto;

import com.example.authservice.service.AuthResult;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Register/Login/Refresh response DTO.
 */
public record AuthResponse(
    @JsonProperty("user")
    UserDto user,

    @JsonProperty("accessToken")
    String accessToken,

    @JsonProperty("refreshToken")
    String refreshToken,

    @JsonProperty("tokenType")
    String tokenType,

    @JsonProperty("expiresIn")
    long expiresIn
) {
    /**
     * Factory method with default tokenType = "Bearer"
     */
    public static AuthResponse of(AuthResult result) {
        return new AuthResponse(
            UserDto.fromEntity(result.user()),
            result.accessToken(),
            result.refreshToken(),
            "Bearer",
            result.expiresIn()
        );
    }
}
