package com.example.authservice.dto;

import jakarta.validation.constraints.Size;

/**
 * Profile update request DTO.
 * A null field is left unchanged; a blank one clears the stored value.
 */
public record UpdateProfileRequest(
    @Size(max = 100, message = "Display name must not exceed 100 characters")
    String displayName,

    @Size(max = 500, message = "Avatar must not exceed 500 characters")
    String avatarRef
) {
}
