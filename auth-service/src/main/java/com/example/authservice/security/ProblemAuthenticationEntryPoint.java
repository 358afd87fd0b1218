package com.example.authservice.security;

import com.example.authservice.exception.ErrorKind;
import com.example.authservice.exception.ProblemResponseFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Writes the 401 problem envelope when a protected endpoint is called without
 * a valid access token, instead of Spring Security's default empty response.
 */
@Slf4j
@Component
public class ProblemAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;
    private final ProblemResponseFactory problemResponseFactory;

    public ProblemAuthenticationEntryPoint(ObjectMapper objectMapper, ProblemResponseFactory problemResponseFactory) {
        this.objectMapper = objectMapper;
        this.problemResponseFactory = problemResponseFactory;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        log.debug("Unauthenticated request to {}", request.getRequestURI());
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problemResponseFactory.create(
                ErrorKind.AUTHENTICATION_ERROR, "Invalid or expired access token", request));
    }
}
