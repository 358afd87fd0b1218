package com.example.authservice.security;

/**
 * One-way password hashing.
 */
public interface PasswordHasher {

    /**
     * Hash a plaintext password. The salt is embedded in the returned digest.
     */
    String hash(String plaintext);

    /**
     * Verify a plaintext password against a stored digest.
     *
     * @return false for a mismatch and for a null or malformed digest; never throws
     */
    boolean verify(String plaintext, String digest);

    /**
     * Run one verification against a fixed digest and discard the result.
     * Called when there is no real digest to check so the response time of a
     * failed sign-in does not depend on whether the account exists.
     */
    void verifyAgainstDecoy(String plaintext);
}
