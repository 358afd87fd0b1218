package com.example.authservice.service;

import com.example.authservice.entity.User;

import java.util.UUID;

/**
 * Outcome of register, login and refresh: the identity and a fresh credential pair.
 *
 * @param expiresIn access token lifetime in seconds
 * @param sessionId id of the refresh token record the access token is bound to
 */
public record AuthResult(
        User user,
        String accessToken,
        String refreshToken,
        long expiresIn,
        UUID sessionId
) {
}
