package com.example.authservice.security;

import com.example.authservice.exception.AuthenticationFailedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Helper class to extract the caller's access token claims from SecurityContext.
 */
@Component
public class SecurityContextHelper {

    /**
     * Get claims of the current access token.
     * @return Optional<AccessTokenClaims> - empty if not authenticated
     */
    public Optional<AccessTokenClaims> getCurrentClaims() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }

        if (authentication.getPrincipal() instanceof AccessTokenClaims claims) {
            return Optional.of(claims);
        }

        return Optional.empty();
    }

    /**
     * Get claims of the current access token, failing with 401 if there are none.
     */
    public AccessTokenClaims requireCurrentClaims() {
        return getCurrentClaims().orElseThrow(AuthenticationFailedException::invalidAccessToken);
    }
}
