package com.example.authservice.security;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Refresh token digests. Only the SHA-256 hex of a token value is stored;
 * lookups and revocations hash the presented value and compare digests.
 */
@Component
public class TokenHasher {

    private static final HexFormat HEX = HexFormat.of();

    public String sha256Hex(String tokenValue) {
        return HEX.formatHex(newSha256().digest(tokenValue.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 MessageDigest unavailable", e);
        }
    }
}
