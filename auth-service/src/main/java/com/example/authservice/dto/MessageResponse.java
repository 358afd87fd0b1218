package com.example.authservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MessageResponse(
    @JsonProperty("message")
    String message
) {
    public static MessageResponse of(String message) {
        return new MessageResponse(message);
    }
}
