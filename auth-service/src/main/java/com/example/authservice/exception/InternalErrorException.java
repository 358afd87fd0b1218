package com.example.authservice.exception;

/**
 * Exception for failures not attributable to caller input (HTTP 500).
 * The cause is logged; clients only see a generic detail.
 */
public class InternalErrorException extends AuthException {

    public InternalErrorException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL_ERROR, message, cause);
    }
}
