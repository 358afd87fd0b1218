package com.example.authservice.security;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and verifies the credentials handed to clients.
 */
public interface TokenIssuer {

    String issueAccessToken(UUID identityId, UUID sessionId);

    String issueRefreshToken();

    /**
     * @return claims if the token is well-formed, correctly signed, an access token and not expired
     */
    Optional<AccessTokenClaims> verifyAccessToken(String token);

    Duration accessTokenTtl();

    Duration refreshTokenTtl();
}
