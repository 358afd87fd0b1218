package com.example.authservice.store;

import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.User;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Durable storage of identities and refresh token records.
 *
 * Every operation is atomic. Operations that decide a race (createIdentity,
 * consumeRefreshToken, the revocations) rely on a database constraint or a
 * conditional update, so concurrent callers across processes see at most one winner.
 * Any operation may throw {@link TransientStorageException}.
 */
public interface CredentialStore {

    /**
     * @throws DuplicateEmailException if the email is already taken
     */
    User createIdentity(NewIdentity identity);

    Optional<User> findIdentityByEmail(String normalizedEmail);

    Optional<User> findIdentityById(UUID id);

    /**
     * Apply a mutation to the stored identity. Last writer wins.
     *
     * @throws IdentityNotFoundException if no identity has this id
     */
    User updateIdentity(UUID id, Consumer<User> mutator);

    /**
     * Persist a new usable record for a refresh token value.
     *
     * @throws IdentityNotFoundException if no identity has this id
     */
    RefreshToken createRefreshToken(UUID identityId, String value, Instant issuedAt, Instant expiresAt);

    /**
     * Atomically mark the record for this value as consumed if it is still usable.
     *
     * @return the consumed record with its owner, or empty if the value is unknown,
     *         already revoked, expired, or another caller consumed it first
     */
    Optional<RefreshToken> consumeRefreshToken(String value, Instant now);

    /**
     * Record which record replaced a consumed one.
     */
    void linkReplacement(UUID consumedId, UUID replacementId);

    /**
     * Revoke a record by id if it belongs to the identity. Idempotent.
     *
     * @return true if this call revoked it
     */
    boolean revokeSession(UUID sessionId, UUID identityId, Instant now);

    /**
     * Revoke a record by value if it belongs to the identity. Idempotent.
     *
     * @return true if this call revoked it
     */
    boolean revokeRefreshToken(String value, UUID identityId, Instant now);

    /**
     * @return number of records revoked
     */
    int revokeAllForIdentity(UUID identityId, Instant now);

    /**
     * Record a successful sign-in.
     *
     * @return the identity with its updated last-login time
     * @throws IdentityNotFoundException if no identity has this id
     */
    User touchLastLogin(UUID identityId, Instant when);
}
