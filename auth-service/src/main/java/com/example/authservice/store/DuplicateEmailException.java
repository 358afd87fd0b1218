package com.example.authservice.store;

/**
 * The database rejected an identity because its email is already taken.
 */
public class DuplicateEmailException extends RuntimeException {

    public DuplicateEmailException(String email, Throwable cause) {
        super("Identity already exists for email: " + email, cause);
    }
}
