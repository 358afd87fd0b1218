package com.example.authservice.service;

import com.example.authservice.security.BCryptPasswordHasher;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Input rules for credentials and profile fields.
 * Each check returns the messages of the rules that failed, empty when the value is valid.
 */
final class CredentialRules {

    static final int EMAIL_MAX_LENGTH = 255;
    static final int PASSWORD_MIN_LENGTH = 8;
    static final int DISPLAY_NAME_MAX_LENGTH = 100;
    static final int AVATAR_MAX_LENGTH = 500;

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern LETTER = Pattern.compile("\\p{L}");
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private CredentialRules() {
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    static List<String> checkEmail(String normalizedEmail) {
        List<String> messages = new ArrayList<>();
        if (normalizedEmail == null || normalizedEmail.isEmpty()) {
            messages.add("Email is required");
            return messages;
        }
        if (normalizedEmail.length() > EMAIL_MAX_LENGTH) {
            messages.add("Email must not exceed " + EMAIL_MAX_LENGTH + " characters");
        }
        if (!EMAIL_PATTERN.matcher(normalizedEmail).matches()) {
            messages.add("Invalid email format");
        }
        return messages;
    }

    static List<String> checkPassword(String password) {
        List<String> messages = new ArrayList<>();
        if (password == null || password.isEmpty()) {
            messages.add("Password is required");
            return messages;
        }
        if (password.length() < PASSWORD_MIN_LENGTH) {
            messages.add("Password must be at least " + PASSWORD_MIN_LENGTH + " characters long");
        }
        if (BCryptPasswordHasher.exceedsMaxBytes(password)) {
            messages.add("Password must not exceed " + BCryptPasswordHasher.MAX_PASSWORD_BYTES + " bytes");
        }
        if (!LETTER.matcher(password).find() || !DIGIT.matcher(password).find()) {
            messages.add("Password must contain at least one letter and one digit");
        }
        return messages;
    }

    static List<String> checkMaxLength(String value, int max, String label) {
        if (value != null && value.trim().length() > max) {
            return List.of(label + " must not exceed " + max + " characters");
        }
        return List.of();
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Trimmed value, or null when blank.
     */
    static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
