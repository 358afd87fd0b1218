package com.example.authservice.security;

import java.time.Instant;
import java.util.UUID;

/**
 * Verified contents of an access token.
 *
 * @param identityId owner of the token (sub)
 * @param sessionId  refresh token record issued together with it (sid)
 */
public record AccessTokenClaims(
        UUID identityId,
        UUID sessionId,
        Instant issuedAt,
        Instant expiresAt
) {
}
