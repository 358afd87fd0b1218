package com.example.authservice.exception;

import com.example.authservice.dto.ProblemResponse;
import com.example.authservice.security.CorrelationIdFilter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private static final Instant NOW = Instant.parse("2025-02-01T08:30:00Z");

    private GlobalExceptionHandler handler;
    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler(new ProblemResponseFactory(Clock.fixed(NOW, ZoneOffset.UTC)));
        request = new MockHttpServletRequest("POST", "/api/auth/login");
        MDC.put(CorrelationIdFilter.MDC_KEY, "corr-1");
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void authenticationFailure_mapsTo401Envelope() {
        ResponseEntity<ProblemResponse> response =
                handler.handleAuthException(AuthenticationFailedException.invalidCredentials(), request);

        ProblemResponse body = response.getBody();
        assertThat(response.getStatusCode().value()).isEqualTo(401);
        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_PROBLEM_JSON);
        assertThat(body).isNotNull();
        assertThat(body.kind()).isEqualTo("AuthenticationError");
        assertThat(body.type()).isEqualTo("https://geoquiz.example.com/problems/authentication-error");
        assertThat(body.title()).isEqualTo("Authentication required");
        assertThat(body.detail()).isEqualTo("Invalid email or password");
        assertThat(body.instance()).isEqualTo("/api/auth/login");
        assertThat(body.timestamp()).isEqualTo(NOW);
        assertThat(body.traceId()).isEqualTo("corr-1");
        assertThat(body.errors()).isNull();
    }

    @Test
    void validationFailure_carriesFieldErrors() {
        ValidationException ex = new ValidationException(Map.of("email", List.of("Invalid email format")));

        ProblemResponse body = handler.handleAuthException(ex, request).getBody();

        assertThat(body).isNotNull();
        assertThat(body.status()).isEqualTo(422);
        assertThat(body.errors()).containsEntry("email", List.of("Invalid email format"));
    }

    @Test
    void internalError_hidesCause() {
        InternalErrorException ex = new InternalErrorException(
                "Storage unavailable during createIdentity", new IllegalStateException("pool exhausted"));

        ProblemResponse body = handler.handleAuthException(ex, request).getBody();

        assertThat(body).isNotNull();
        assertThat(body.status()).isEqualTo(500);
        assertThat(body.detail()).isEqualTo(GlobalExceptionHandler.INTERNAL_DETAIL);
    }

    @Test
    void unexpectedException_mapsToInternalError() {
        ResponseEntity<ProblemResponse> response =
                handler.handleGenericException(new IllegalStateException("boom"), request);

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().kind()).isEqualTo("InternalError");
        assertThat(response.getBody().detail()).doesNotContain("boom");
    }

    @Test
    void everyKind_hasDistinctTypeAndStatus() {
        EnumSet<ErrorKind> kinds = EnumSet.allOf(ErrorKind.class);

        assertThat(kinds).extracting(ErrorKind::getType).doesNotHaveDuplicates();
        assertThat(kinds).extracting(k -> k.getStatus().value())
                .containsExactlyInAnyOrder(422, 401, 409, 404, 500);
    }
}
