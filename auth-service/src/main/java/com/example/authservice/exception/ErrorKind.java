package com.example.authservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Closed set of failure kinds surfaced to clients.
 * Each kind fixes the HTTP status, the problem type slug and the problem title.
 */
@Getter
public enum ErrorKind {

    VALIDATION_ERROR("ValidationError", HttpStatus.UNPROCESSABLE_ENTITY,
            "validation-error", "One or more validation errors occurred."),
    AUTHENTICATION_ERROR("AuthenticationError", HttpStatus.UNAUTHORIZED,
            "authentication-error", "Authentication required"),
    CONFLICT_ERROR("ConflictError", HttpStatus.CONFLICT,
            "conflict-error", "Resource conflict"),
    NOT_FOUND_ERROR("NotFoundError", HttpStatus.NOT_FOUND,
            "not-found-error", "Resource not found"),
    INTERNAL_ERROR("InternalError", HttpStatus.INTERNAL_SERVER_ERROR,
            "internal-server-error", "An error occurred while processing your request.");

    public static final String PROBLEM_TYPE_BASE_URI = "https://geoquiz.example.com/problems/";

    private final String kindName;
    private final HttpStatus status;
    private final String slug;
    private final String title;

    ErrorKind(String kindName, HttpStatus status, String slug, String title) {
        this.kindName = kindName;
        this.status = status;
        this.slug = slug;
        this.title = title;
    }

    public String getType() {
        return PROBLEM_TYPE_BASE_URI + slug;
    }
}
