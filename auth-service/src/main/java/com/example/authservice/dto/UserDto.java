package com.example.authservice.dto;

import com.example.authservice.entity.User;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * User DTO for API responses.
 */
public record UserDto(
    @JsonProperty("id")
    UUID id,

    @JsonProperty("email")
    String email,

    @JsonProperty("displayName")
    String displayName,

    @JsonProperty("avatarRef")
    String avatarRef,

    @JsonProperty("provider")
    String provider,

    @JsonProperty("createdAt")
    Instant createdAt,

    @JsonProperty("lastLoginAt")
    Instant lastLoginAt
) {
    /**
     * Factory method to create UserDto from User entity.
     */
    public static UserDto fromEntity(User user) {
        return new UserDto(
            user.getId(),
            user.getEmail(),
            user.getDisplayName(),
            user.getAvatarRef(),
            user.getProvider(),
            user.getCreatedAt(),
            user.getLastLoginAt()
        );
    }
}
