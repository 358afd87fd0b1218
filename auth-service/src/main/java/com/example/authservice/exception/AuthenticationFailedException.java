package com.example.authservice.exception;

/**
 * Exception for failed authentication (HTTP 401).
 * Messages never reveal which check failed.
 */
public class AuthenticationFailedException extends AuthException {

    public AuthenticationFailedException(String message) {
        super(ErrorKind.AUTHENTICATION_ERROR, message);
    }

    /**
     * Unknown email, account without password or wrong password.
     */
    public static AuthenticationFailedException invalidCredentials() {
        return new AuthenticationFailedException("Invalid email or password");
    }

    /**
     * Unknown, expired, revoked or already rotated refresh token.
     */
    public static AuthenticationFailedException invalidRefreshToken() {
        return new AuthenticationFailedException("Invalid or expired refresh token");
    }

    public static AuthenticationFailedException invalidAccessToken() {
        return new AuthenticationFailedException("Invalid or expired access token");
    }

    public static AuthenticationFailedException wrongCurrentPassword() {
        return new AuthenticationFailedException("Current password is incorrect");
    }
}
