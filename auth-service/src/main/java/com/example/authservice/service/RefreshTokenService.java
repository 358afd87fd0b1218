package com.example.authservice.service;

import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.User;
import com.example.authservice.security.TokenIssuer;
import com.example.authservice.store.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Refresh Token lifecycle: session start, rotation and revocation.
 *
 * A session is one refresh token record; access tokens carry its id (sid).
 * Rotation consumes the presented record and opens its replacement in one
 * transaction, so a failure after the consume leaves the old token usable.
 */
@Service
public class RefreshTokenService {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenService.class);

    private final CredentialStore credentialStore;
    private final TokenIssuer tokenIssuer;
    private final Clock clock;

    public RefreshTokenService(CredentialStore credentialStore, TokenIssuer tokenIssuer, Clock clock) {
        this.credentialStore = credentialStore;
        this.tokenIssuer = tokenIssuer;
        this.clock = clock;
    }

    /**
     * Open a session: persist a new refresh token, issue an access token bound to it
     * and record the sign-in time.
     */
    @Transactional
    public AuthResult startSession(UUID identityId) {
        return openSession(identityId, clock.instant());
    }

    /**
     * Exchange a refresh token for a new pair.
     * Used in UC-REFRESH-TOKEN.
     *
     * @return empty if the token is unknown, expired, revoked, or lost the race to a concurrent exchange
     */
    @Transactional
    public Optional<AuthResult> rotate(String refreshTokenValue) {
        Instant now = clock.instant();
        Optional<RefreshToken> consumed = credentialStore.consumeRefreshToken(refreshTokenValue, now);
        if (consumed.isEmpty()) {
            return Optional.empty();
        }
        RefreshToken previous = consumed.get();
        AuthResult next = openSession(previous.getUser().getId(), now);
        credentialStore.linkReplacement(previous.getId(), next.sessionId());

        log.debug("Refresh token {} rotated to {} for user {}",
                previous.getId(), next.sessionId(), next.user().getId());
        return Optional.of(next);
    }

    /**
     * Revoke the session bound to an access token and, if given, one more refresh
     * token of the same user. Missing or already revoked tokens are ignored.
     * Used in UC-LOGOUT.
     */
    @Transactional
    public void revoke(UUID identityId, UUID sessionId, String refreshTokenValue) {
        Instant now = clock.instant();
        boolean sessionRevoked = credentialStore.revokeSession(sessionId, identityId, now);
        boolean tokenRevoked = refreshTokenValue != null
                && credentialStore.revokeRefreshToken(refreshTokenValue, identityId, now);
        log.debug("Logout for user {}: session revoked={}, supplied token revoked={}",
                identityId, sessionRevoked, tokenRevoked);
    }

    /**
     * Revoke all refresh tokens of a user.
     * Used in UC-LOGOUT-ALL.
     *
     * @return number of tokens revoked
     */
    @Transactional
    public int revokeAll(UUID identityId) {
        return credentialStore.revokeAllForIdentity(identityId, clock.instant());
    }

    private AuthResult openSession(UUID identityId, Instant now) {
        String refreshTokenValue = tokenIssuer.issueRefreshToken();
        RefreshToken record = credentialStore.createRefreshToken(
                identityId, refreshTokenValue, now, now.plus(tokenIssuer.refreshTokenTtl()));
        User user = credentialStore.touchLastLogin(identityId, now);
        String accessToken = tokenIssuer.issueAccessToken(identityId, record.getId());

        return new AuthResult(user, accessToken, refreshTokenValue,
                tokenIssuer.accessTokenTtl().toSeconds(), record.getId());
    }
}
