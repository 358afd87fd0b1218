package com.example.authservice.exception;

import lombok.Getter;

/**
 * Base exception class for all business exceptions of the auth service.
 * The message is what clients see as the problem detail.
 */
@Getter
public abstract class AuthException extends RuntimeException {

    private final ErrorKind kind;

    protected AuthException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AuthException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
