package com.example.authservice.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * PasswordHasher backed by the BCrypt PasswordEncoder bean.
 *
 * BCrypt only reads the first 72 bytes of its input, so longer passwords are
 * refused by hash and never verify.
 */
@Slf4j
@Component
public class BCryptPasswordHasher implements PasswordHasher {

    public static final int MAX_PASSWORD_BYTES = 72;

    private final PasswordEncoder passwordEncoder;
    private final String decoyDigest;

    public BCryptPasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        // same work factor as real digests
        this.decoyDigest = passwordEncoder.encode("decoy-password-not-used-for-any-account");
    }

    @Override
    public String hash(String plaintext) {
        if (exceedsMaxBytes(plaintext)) {
            throw new IllegalArgumentException("Password must not exceed " + MAX_PASSWORD_BYTES + " bytes");
        }
        return passwordEncoder.encode(plaintext);
    }

    @Override
    public boolean verify(String plaintext, String digest) {
        if (plaintext == null || digest == null || digest.isBlank()) {
            return false;
        }
        if (exceedsMaxBytes(plaintext)) {
            verifyAgainstDecoy(null);
            return false;
        }
        // BCryptPasswordEncoder logs and returns false for digests it cannot parse
        return passwordEncoder.matches(plaintext, digest);
    }

    @Override
    public void verifyAgainstDecoy(String plaintext) {
        boolean matched = passwordEncoder.matches(plaintext == null ? "" : plaintext, decoyDigest);
        log.trace("Decoy password check completed (matched={})", matched);
    }

    public static boolean exceedsMaxBytes(String plaintext) {
        return plaintext != null && plaintext.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
