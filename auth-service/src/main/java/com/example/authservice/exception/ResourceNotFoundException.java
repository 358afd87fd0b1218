package com.example.authservice.exception;

import java.util.UUID;

/**
 * Exception for resource not found (HTTP 404).
 */
public class ResourceNotFoundException extends AuthException {

    public ResourceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND_ERROR, message);
    }

    public static ResourceNotFoundException userNotFound(UUID userId) {
        return new ResourceNotFoundException("User not found: " + userId);
    }
}
