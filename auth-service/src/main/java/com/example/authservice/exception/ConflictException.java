package com.example.authservice.exception;

/**
 * Exception for conflict errors (HTTP 409).
 */
public class ConflictException extends AuthException {

    public ConflictException(String message, Throwable cause) {
        super(ErrorKind.CONFLICT_ERROR, message, cause);
    }

    public static ConflictException emailAlreadyExists(Throwable cause) {
        return new ConflictException("User with this email already exists", cause);
    }
}
