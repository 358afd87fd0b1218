package com.example.authservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Registration request DTO.
 *
 * Validation Rules:
 * - email: required, max 255 chars, well-formed (checked in service layer)
 * - password: 8 chars to 72 bytes, at least one letter and one digit (checked in service layer)
 * - confirmPassword: must match password
 * - displayName: optional, max 100 chars
 */
public record RegisterRequest(
    @NotBlank(message = "Email is required")
    @Size(max = 255, message = "Email must not exceed 255 characters")
    String email,

    @NotBlank(message = "Password is required")
    String password,

    @NotBlank(message = "Confirm password is required")
    String confirmPassword,

    @Size(max = 100, message = "Display name must not exceed 100 characters")
    String displayName
) {
}
