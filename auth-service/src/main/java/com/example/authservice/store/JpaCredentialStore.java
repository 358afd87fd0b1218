package com.example.authservice.store;

import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.User;
import com.example.authservice.repository.RefreshTokenRepository;
import com.example.authservice.repository.UserRepository;
import com.example.authservice.security.TokenHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.annotation.Transactional;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * CredentialStore on Spring Data JPA.
 *
 * Email uniqueness is left to uk_users_email and surfaced from the flush.
 * Token consumption is one conditional UPDATE; its row count decides the winner.
 * Callers that need several operations in one transaction (rotation) open it
 * themselves; these methods join it.
 */
@Component
@Transactional
public class JpaCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(JpaCredentialStore.class);

    private static final String SQLSTATE_UNIQUE_VIOLATION = "23505";

    private final UserRepository userRepository;
    private final RefreshTokenRepository refreshTokenRepository;
    private final TokenHasher tokenHasher;
    private final Clock clock;

    public JpaCredentialStore(UserRepository userRepository,
                              RefreshTokenRepository refreshTokenRepository,
                              TokenHasher tokenHasher,
                              Clock clock) {
        this.userRepository = userRepository;
        this.refreshTokenRepository = refreshTokenRepository;
        this.tokenHasher = tokenHasher;
        this.clock = clock;
    }

    @Override
    public User createIdentity(NewIdentity identity) {
        return translate("createIdentity", () -> {
            Instant now = clock.instant();
            User user = new User();
            user.setEmail(identity.email());
            user.setPasswordHash(identity.passwordHash());
            user.setDisplayName(identity.displayName());
            user.setProvider(identity.provider());
            user.setCreatedAt(now);
            user.setUpdatedAt(now);
            try {
                // flush now so the unique constraint fires inside this call
                return userRepository.saveAndFlush(user);
            } catch (DataIntegrityViolationException e) {
                if (isUniqueViolation(e)) {
                    throw new DuplicateEmailException(identity.email(), e);
                }
                throw e;
            }
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findIdentityByEmail(String normalizedEmail) {
        return translate("findIdentityByEmail", () -> userRepository.findByEmail(normalizedEmail));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findIdentityById(UUID id) {
        return translate("findIdentityById", () -> userRepository.findById(id));
    }

    @Override
    public User updateIdentity(UUID id, Consumer<User> mutator) {
        return translate("updateIdentity", () -> {
            User user = userRepository.findById(id)
                    .orElseThrow(() -> new IdentityNotFoundException(id));
            mutator.accept(user);
            user.setUpdatedAt(clock.instant());
            return userRepository.saveAndFlush(user);
        });
    }

    @Override
    public RefreshToken createRefreshToken(UUID identityId, String value, Instant issuedAt, Instant expiresAt) {
        return translate("createRefreshToken", () -> {
            User user = userRepository.findById(identityId)
                    .orElseThrow(() -> new IdentityNotFoundException(identityId));
            RefreshToken token = new RefreshToken();
            token.setUser(user);
            token.setTokenHash(tokenHasher.sha256Hex(value));
            token.setIssuedAt(issuedAt);
            token.setExpiresAt(expiresAt);
            return refreshTokenRepository.saveAndFlush(token);
        });
    }

    @Override
    public Optional<RefreshToken> consumeRefreshToken(String value, Instant now) {
        return translate("consumeRefreshToken", () -> {
            String tokenHash = tokenHasher.sha256Hex(value);
            int updated = refreshTokenRepository.consume(tokenHash, now);
            if (updated == 0) {
                return Optional.<RefreshToken>empty();
            }
            return refreshTokenRepository.findWithUserByTokenHash(tokenHash);
        });
    }

    @Override
    public void linkReplacement(UUID consumedId, UUID replacementId) {
        translate("linkReplacement", () -> refreshTokenRepository.linkReplacement(consumedId, replacementId));
    }

    @Override
    public boolean revokeSession(UUID sessionId, UUID identityId, Instant now) {
        return translate("revokeSession",
                () -> refreshTokenRepository.revokeByIdAndUserId(sessionId, identityId, now) > 0);
    }

    @Override
    public boolean revokeRefreshToken(String value, UUID identityId, Instant now) {
        return translate("revokeRefreshToken", () -> refreshTokenRepository.revokeByTokenHashAndUserId(
                tokenHasher.sha256Hex(value), identityId, now) > 0);
    }

    @Override
    public int revokeAllForIdentity(UUID identityId, Instant now) {
        return translate("revokeAllForIdentity", () -> refreshTokenRepository.revokeAllByUserId(identityId, now));
    }

    @Override
    public User touchLastLogin(UUID identityId, Instant when) {
        return translate("touchLastLogin", () -> {
            User user = userRepository.findById(identityId)
                    .orElseThrow(() -> new IdentityNotFoundException(identityId));
            user.setLastLoginAt(when);
            return userRepository.saveAndFlush(user);
        });
    }

    private <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException | RecoverableDataAccessException
                 | DataAccessResourceFailureException | TransactionTimedOutException e) {
            log.warn("Storage operation {} failed: {}", operation, e.getMessage());
            throw new TransientStorageException(operation, e);
        }
    }

    private static boolean isUniqueViolation(DataIntegrityViolationException e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof SQLException sqlException
                    && SQLSTATE_UNIQUE_VIOLATION.equals(sqlException.getSQLState())) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
