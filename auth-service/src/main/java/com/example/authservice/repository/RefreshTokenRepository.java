package com.example.authservice.repository;

import com.example.authservice.entity.RefreshToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for RefreshToken entity.
 *
 * Every state change is a single conditional UPDATE. The affected-row count
 * tells the caller whether it won; no row is ever locked in application code.
 */
@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    /**
     * Find refresh token by digest, fetching its owner.
     *
     * @param tokenHash SHA-256 hex of the token value
     * @return Optional<RefreshToken>
     */
    @Query("SELECT rt FROM RefreshToken rt JOIN FETCH rt.user WHERE rt.tokenHash = :tokenHash")
    Optional<RefreshToken> findWithUserByTokenHash(@Param("tokenHash") String tokenHash);

    /**
     * Atomically mark a usable token as consumed.
     * Used in UC-REFRESH-TOKEN. Of any number of concurrent callers presenting the
     * same value, at most one sees 1; the rest see 0.
     *
     * @param tokenHash SHA-256 hex of the token value
     * @param now       current instant
     * @return number of updated rows (0 or 1)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RefreshToken rt SET rt.revoked = true, rt.revokedAt = :now " +
           "WHERE rt.tokenHash = :tokenHash AND rt.revoked = false AND rt.expiresAt > :now")
    int consume(@Param("tokenHash") String tokenHash, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RefreshToken rt SET rt.replacedBy = :childId WHERE rt.id = :id AND rt.replacedBy IS NULL")
    int linkReplacement(@Param("id") UUID id, @Param("childId") UUID childId);

    /**
     * Revoke one session, scoped to its owner.
     * Used in UC-LOGOUT for the session bound to the access token.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RefreshToken rt SET rt.revoked = true, rt.revokedAt = :now " +
           "WHERE rt.id = :id AND rt.user.id = :userId AND rt.revoked = false")
    int revokeByIdAndUserId(@Param("id") UUID id, @Param("userId") UUID userId, @Param("now") Instant now);

    /**
     * Revoke one token by digest, scoped to its owner.
     * Used in UC-LOGOUT for an explicitly supplied refresh token.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RefreshToken rt SET rt.revoked = true, rt.revokedAt = :now " +
           "WHERE rt.tokenHash = :tokenHash AND rt.user.id = :userId AND rt.revoked = false")
    int revokeByTokenHashAndUserId(@Param("tokenHash") String tokenHash,
                                   @Param("userId") UUID userId,
                                   @Param("now") Instant now);

    /**
     * Revoke all refresh tokens for a user.
     * Used in UC-LOGOUT-ALL.
     *
     * @return number of updated rows
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RefreshToken rt SET rt.revoked = true, rt.revokedAt = :now " +
           "WHERE rt.user.id = :userId AND rt.revoked = false")
    int revokeAllByUserId(@Param("userId") UUID userId, @Param("now") Instant now);
}
