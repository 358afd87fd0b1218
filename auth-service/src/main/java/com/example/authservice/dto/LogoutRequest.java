package com.example.authservice.dto;

/**
 * Logout request DTO. The body is optional; when present, the given refresh
 * token is revoked in addition to the session of the access token.
 */
public record LogoutRequest(
    String refreshToken
) {
}
