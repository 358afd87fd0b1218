package com.example.authservice.exception;

import com.example.authservice.dto.ProblemResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for the application.
 * Maps exceptions to the problem envelope, served as application/problem+json.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String INTERNAL_DETAIL = "An internal server error occurred";

    private final ProblemResponseFactory problemResponseFactory;

    public GlobalExceptionHandler(ProblemResponseFactory problemResponseFactory) {
        this.problemResponseFactory = problemResponseFactory;
    }

    /**
     * Handle business exceptions.
     */
    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ProblemResponse> handleAuthException(AuthException ex, HttpServletRequest request) {
        ErrorKind kind = ex.getKind();
        ProblemResponse body = switch (kind) {
            case VALIDATION_ERROR -> {
                Map<String, List<String>> errors = ex instanceof ValidationException validation
                        ? validation.getErrors() : null;
                log.debug("Validation failed on {}: {}", request.getRequestURI(), errors);
                yield problemResponseFactory.create(kind, kind.getStatus().value(), ex.getMessage(), request, errors);
            }
            case AUTHENTICATION_ERROR -> {
                log.warn("Authentication failed on {}: {}", request.getRequestURI(), ex.getMessage());
                yield problemResponseFactory.create(kind, ex.getMessage(), request);
            }
            case CONFLICT_ERROR, NOT_FOUND_ERROR -> {
                log.info("{} on {}: {}", kind.getKindName(), request.getRequestURI(), ex.getMessage());
                yield problemResponseFactory.create(kind, ex.getMessage(), request);
            }
            case INTERNAL_ERROR -> {
                log.error("Internal error on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
                yield problemResponseFactory.create(kind, INTERNAL_DETAIL, request);
            }
        };
        return respond(body);
    }

    /**
     * Handle bean validation failures on request bodies.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        Map<String, List<String>> errors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.computeIfAbsent(error.getField(), k -> new ArrayList<>()).add(error.getDefaultMessage());
        }

        log.debug("Validation failed on {}: {}", request.getRequestURI(), errors);

        ErrorKind kind = ErrorKind.VALIDATION_ERROR;
        return respond(problemResponseFactory.create(
                kind, kind.getStatus().value(), "One or more validation errors occurred.", request, errors));
    }

    /**
     * Handle missing or malformed JSON bodies (400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.debug("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(problemResponseFactory.create(ErrorKind.VALIDATION_ERROR, HttpStatus.BAD_REQUEST.value(),
                "Request body is missing or malformed", request, null));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ProblemResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        return respond(problemResponseFactory.create(ErrorKind.VALIDATION_ERROR,
                HttpStatus.METHOD_NOT_ALLOWED.value(), ex.getMessage(), request, null));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ProblemResponse> handleMediaTypeNotSupported(
            HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {
        return respond(problemResponseFactory.create(ErrorKind.VALIDATION_ERROR,
                HttpStatus.UNSUPPORTED_MEDIA_TYPE.value(), ex.getMessage(), request, null));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ProblemResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return respond(problemResponseFactory.create(ErrorKind.NOT_FOUND_ERROR,
                "No endpoint " + request.getRequestURI(), request));
    }

    /**
     * Handle Spring Security authentication exceptions.
     */
    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ProblemResponse> handleSpringAuthenticationException(
            AuthenticationException ex, HttpServletRequest request) {
        log.warn("Authentication failed on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(problemResponseFactory.create(ErrorKind.AUTHENTICATION_ERROR,
                "Invalid or expired access token", request));
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return respond(problemResponseFactory.create(ErrorKind.INTERNAL_ERROR, INTERNAL_DETAIL, request));
    }

    private static ResponseEntity<ProblemResponse> respond(ProblemResponse body) {
        return ResponseEntity.status(body.status())
                .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .body(body);
    }
}
