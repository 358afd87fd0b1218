package com.example.authservice.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exception for invalid caller input (HTTP 422).
 * Carries field name to messages for every rule that failed.
 */
@Getter
public class ValidationException extends AuthException {

    private final Map<String, List<String>> errors;

    public ValidationException(Map<String, List<String>> errors) {
        super(ErrorKind.VALIDATION_ERROR, "One or more validation errors occurred.");
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static ValidationException of(String field, String message) {
        return new ValidationException(Map.of(field, List.of(message)));
    }
}
