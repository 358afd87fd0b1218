package com.example.authservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Logout-all response DTO.
 */
public record RevocationResponse(
    @JsonProperty("message")
    String message,

    @JsonProperty("revoked")
    int revoked
) {
}
