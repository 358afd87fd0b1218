package com.example.authservice.dto;

import com.example.authservice.entity.User;
import com.fasterxml.jackson.annotation.JsonProperty;

public record UserResponse(
    @JsonProperty("user")
    UserDto user
) {
    public static UserResponse of(User user) {
        return new UserResponse(UserDto.fromEntity(user));
    }
}
