package com.example.authservice.store;

/**
 * Values for a new identity. Email must already be normalized.
 */
public record NewIdentity(
        String email,
        String passwordHash,
        String displayName,
        String provider
) {
}
