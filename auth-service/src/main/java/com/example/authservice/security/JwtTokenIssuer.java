package com.example.authservice.security;

import com.example.authservice.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * JWT implementation of TokenIssuer.
 *
 * Algorithm: HS256
 * Signing Key: auth.jwt.secret (at least 32 bytes, startup fails otherwise)
 * Access Token TTL: auth.jwt.access-token-ttl, 15 minutes by default
 *
 * Claims:
 * - sub: identity id
 * - sid: id of the refresh token record issued with this token
 * - token_type: ACCESS
 * - iat, exp, jti
 */
@Slf4j
@Component
public class JwtTokenIssuer implements TokenIssuer {

    static final String CLAIM_SESSION_ID = "sid";
    static final String CLAIM_TOKEN_TYPE = "token_type";
    static final String TOKEN_TYPE_ACCESS = "ACCESS";

    private final SecretKey secretKey;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;
    private final RefreshTokenGenerator refreshTokenGenerator;
    private final JwtParser parser;

    public JwtTokenIssuer(AuthProperties properties, Clock clock, RefreshTokenGenerator refreshTokenGenerator) {
        // HS256 requires at least 256 bits (32 bytes) key; hmacShaKeyFor rejects shorter ones
        this.secretKey = Keys.hmacShaKeyFor(properties.jwt().secret().getBytes(StandardCharsets.UTF_8));
        this.accessTokenTtl = properties.jwt().accessTokenTtl();
        this.refreshTokenTtl = properties.refreshTokenTtl();
        this.clock = clock;
        this.refreshTokenGenerator = refreshTokenGenerator;
        this.parser = Jwts.parser()
                .verifyWith(secretKey)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    @Override
    public String issueAccessToken(UUID identityId, UUID sessionId) {
        Instant now = clock.instant();
        Instant expiration = now.plus(accessTokenTtl);

        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(identityId.toString())
                .claim(CLAIM_SESSION_ID, sessionId.toString())
                .claim(CLAIM_TOKEN_TYPE, TOKEN_TYPE_ACCESS)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiration))
                .signWith(secretKey)
                .compact();
    }

    @Override
    public String issueRefreshToken() {
        return refreshTokenGenerator.generate();
    }

    @Override
    public Optional<AccessTokenClaims> verifyAccessToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            if (!TOKEN_TYPE_ACCESS.equals(claims.get(CLAIM_TOKEN_TYPE, String.class))) {
                return Optional.empty();
            }
            String sessionId = claims.get(CLAIM_SESSION_ID, String.class);
            if (claims.getSubject() == null || sessionId == null
                    || claims.getIssuedAt() == null || claims.getExpiration() == null) {
                return Optional.empty();
            }
            return Optional.of(new AccessTokenClaims(
                    UUID.fromString(claims.getSubject()),
                    UUID.fromString(sessionId),
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant()));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected access token: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    @Override
    public Duration accessTokenTtl() {
        return accessTokenTtl;
    }

    @Override
    public Duration refreshTokenTtl() {
        return refreshTokenTtl;
    }
}
