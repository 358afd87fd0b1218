package com.example.authservice.service;

import com.example.authservice.config.ResilienceConfig;
import com.example.authservice.entity.User;
import com.example.authservice.exception.AuthenticationFailedException;
import com.example.authservice.exception.ConflictException;
import com.example.authservice.exception.InternalErrorException;
import com.example.authservice.exception.ResourceNotFoundException;
import com.example.authservice.exception.ValidationException;
import com.example.authservice.security.AccessTokenClaims;
import com.example.authservice.security.PasswordHasher;
import com.example.authservice.store.CredentialStore;
import com.example.authservice.store.DuplicateEmailException;
import com.example.authservice.store.IdentityNotFoundException;
import com.example.authservice.store.NewIdentity;
import com.example.authservice.store.TransientStorageException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Authentication Service.
 * Handles register, login, token refresh, logout, password change and profile.
 *
 * Security Features:
 * - BCrypt password hashing
 * - Refresh token rotation (each token is exchanged at most once)
 * - Identical failure for unknown email and wrong password, with matching timing
 *
 * Store failures are translated here: duplicate email to Conflict, missing identity
 * to NotFound, transient storage errors to Internal. Only reads are retried.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final RefreshTokenService refreshTokenService;
    private final Retry readRetry;

    public AuthService(CredentialStore credentialStore,
                       PasswordHasher passwordHasher,
                       RefreshTokenService refreshTokenService,
                       RetryRegistry retryRegistry) {
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.refreshTokenService = refreshTokenService;
        this.readRetry = retryRegistry.retry(ResilienceConfig.CREDENTIAL_STORE_READS);
    }

    /**
     * Register a new account and sign it in.
     * Used in UC-REGISTER.
     *
     * Concurrent registrations of the same email are decided by the database:
     * exactly one succeeds and the rest get ConflictException.
     * The identity and its first session commit together; if the session cannot be
     * written the identity is rolled back and the email stays free.
     *
     * @throws ValidationException if any input rule fails
     * @throws ConflictException   if the email is already registered
     */
    @Transactional
    public AuthResult register(String email, String password, String confirmPassword, String displayName) {
        String normalizedEmail = CredentialRules.normalizeEmail(email);

        Map<String, List<String>> errors = new LinkedHashMap<>();
        addErrors(errors, "email", CredentialRules.checkEmail(normalizedEmail));
        addErrors(errors, "password", CredentialRules.checkPassword(password));
        if (password != null && !password.equals(confirmPassword)) {
            addErrors(errors, "confirmPassword", List.of("Passwords do not match"));
        }
        addErrors(errors, "displayName", CredentialRules.checkMaxLength(
                displayName, CredentialRules.DISPLAY_NAME_MAX_LENGTH, "Display name"));
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        String passwordHash = passwordHasher.hash(password);
        User user;
        try {
            user = mutate("createIdentity", () -> credentialStore.createIdentity(new NewIdentity(
                    normalizedEmail, passwordHash, CredentialRules.trimToNull(displayName), User.PROVIDER_EMAIL)));
        } catch (DuplicateEmailException e) {
            log.info("Registration rejected, email already registered");
            throw ConflictException.emailAlreadyExists(e);
        }

        log.info("User registered: {}", user.getId());
        return startSession(user.getId());
    }

    /**
     * Authenticate with email and password.
     * Used in UC-LOGIN.
     *
     * @throws AuthenticationFailedException for unknown email, password-less account or wrong password
     */
    public AuthResult login(String email, String password) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (CredentialRules.isBlank(email)) {
            addErrors(errors, "email", List.of("Email is required"));
        }
        if (password == null || password.isEmpty()) {
            addErrors(errors, "password", List.of("Password is required"));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        String normalizedEmail = CredentialRules.normalizeEmail(email);
        Optional<User> found = read("findIdentityByEmail",
                () -> credentialStore.findIdentityByEmail(normalizedEmail));

        if (found.isEmpty() || !found.get().hasPassword()) {
            passwordHasher.verifyAgainstDecoy(password);
            log.warn("Login failed: no password account for the given email");
            throw AuthenticationFailedException.invalidCredentials();
        }
        User user = found.get();
        if (!passwordHasher.verify(password, user.getPasswordHash())) {
            log.warn("Login failed: wrong password for user {}", user.getId());
            throw AuthenticationFailedException.invalidCredentials();
        }

        log.info("User logged in: {}", user.getId());
        return startSession(user.getId());
    }

    /**
     * Exchange a refresh token for a new token pair. The presented token is consumed.
     * Used in UC-REFRESH-TOKEN.
     *
     * @throws AuthenticationFailedException if the token is unknown, expired, revoked or already used
     */
    public AuthResult refresh(String refreshToken) {
        if (CredentialRules.isBlank(refreshToken)) {
            throw ValidationException.of("refreshToken", "Refresh token is required");
        }
        Optional<AuthResult> rotated;
        try {
            rotated = mutate("rotateRefreshToken", () -> refreshTokenService.rotate(refreshToken));
        } catch (IdentityNotFoundException e) {
            log.warn("Refresh token owner no longer exists");
            throw AuthenticationFailedException.invalidRefreshToken();
        }
        return rotated.orElseThrow(() -> {
            log.warn("Refresh rejected: token unknown, expired, revoked or already used");
            return AuthenticationFailedException.invalidRefreshToken();
        });
    }

    /**
     * Revoke the caller's session and optionally one more of the caller's refresh tokens.
     * Idempotent.
     * Used in UC-LOGOUT.
     */
    public void logout(AccessTokenClaims caller, String refreshToken) {
        mutate("logout", () -> {
            refreshTokenService.revoke(caller.identityId(), caller.sessionId(),
                    CredentialRules.isBlank(refreshToken) ? null : refreshToken);
            return null;
        });
        log.info("User logged out: {}", caller.identityId());
    }

    /**
     * Revoke every active refresh token of the caller.
     * Used in UC-LOGOUT-ALL.
     *
     * @return number of tokens revoked
     */
    public int logoutAll(UUID identityId) {
        int revoked = mutate("logoutAll", () -> refreshTokenService.revokeAll(identityId));
        log.info("All sessions revoked for user {}: {} tokens", identityId, revoked);
        return revoked;
    }

    /**
     * Change password after verifying the current one.
     * A wrong current password leaves the stored hash untouched.
     * Existing sessions stay valid.
     *
     * @throws AuthenticationFailedException if the current password is wrong
     * @throws ResourceNotFoundException     if the user no longer exists
     */
    public void changePassword(UUID identityId, String currentPassword, String newPassword) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (currentPassword == null || currentPassword.isEmpty()) {
            addErrors(errors, "currentPassword", List.of("Current password is required"));
        }
        addErrors(errors, "newPassword", CredentialRules.checkPassword(newPassword));
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        User user = read("findIdentityById", () -> credentialStore.findIdentityById(identityId))
                .orElseThrow(() -> ResourceNotFoundException.userNotFound(identityId));
        if (!user.hasPassword() || !passwordHasher.verify(currentPassword, user.getPasswordHash())) {
            log.warn("Password change rejected for user {}: current password mismatch", identityId);
            throw AuthenticationFailedException.wrongCurrentPassword();
        }

        String newHash = passwordHasher.hash(newPassword);
        try {
            mutate("updateIdentity", () -> credentialStore.updateIdentity(identityId, u -> u.setPasswordHash(newHash)));
        } catch (IdentityNotFoundException e) {
            throw ResourceNotFoundException.userNotFound(identityId);
        }
        log.info("Password changed for user {}", identityId);
    }

    /**
     * Update display name and avatar. Null leaves a field unchanged, blank clears it.
     *
     * @throws ResourceNotFoundException if the user no longer exists
     */
    public User updateProfile(UUID identityId, String displayName, String avatarRef) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        addErrors(errors, "displayName", CredentialRules.checkMaxLength(
                displayName, CredentialRules.DISPLAY_NAME_MAX_LENGTH, "Display name"));
        addErrors(errors, "avatarRef", CredentialRules.checkMaxLength(
                avatarRef, CredentialRules.AVATAR_MAX_LENGTH, "Avatar"));
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        try {
            return mutate("updateIdentity", () -> credentialStore.updateIdentity(identityId, user -> {
                if (displayName != null) {
                    user.setDisplayName(CredentialRules.trimToNull(displayName));
                }
                if (avatarRef != null) {
                    user.setAvatarRef(CredentialRules.trimToNull(avatarRef));
                }
            }));
        } catch (IdentityNotFoundException e) {
            throw ResourceNotFoundException.userNotFound(identityId);
        }
    }

    /**
     * Get the authenticated user.
     *
     * @throws ResourceNotFoundException if the user no longer exists
     */
    public User getCurrentUser(UUID identityId) {
        return read("findIdentityById", () -> credentialStore.findIdentityById(identityId))
                .orElseThrow(() -> ResourceNotFoundException.userNotFound(identityId));
    }

    private AuthResult startSession(UUID identityId) {
        return mutate("startSession", () -> refreshTokenService.startSession(identityId));
    }

    private <T> T read(String operation, Supplier<T> supplier) {
        try {
            return Retry.decorateSupplier(readRetry, supplier).get();
        } catch (TransientStorageException e) {
            throw new InternalErrorException("Storage unavailable during " + operation, e);
        }
    }

    private <T> T mutate(String operation, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (TransientStorageException e) {
            throw new InternalErrorException("Storage unavailable during " + operation, e);
        }
    }

    private static void addErrors(Map<String, List<String>> errors, String field, List<String> messages) {
        if (!messages.isEmpty()) {
            errors.computeIfAbsent(field, k -> new ArrayList<>()).addAll(messages);
        }
    }
}
