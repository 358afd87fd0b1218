package com.example.authservice.exception;

import com.example.authservice.dto.ProblemResponse;
import com.example.authservice.security.CorrelationIdFilter;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the error envelope shared by the exception handler and the security entry point.
 */
@Component
public class ProblemResponseFactory {

    private final Clock clock;

    public ProblemResponseFactory(Clock clock) {
        this.clock = clock;
    }

    public ProblemResponse create(ErrorKind kind, String detail, HttpServletRequest request) {
        return create(kind, kind.getStatus().value(), detail, request, null);
    }

    public ProblemResponse create(ErrorKind kind, int status, String detail, HttpServletRequest request,
                                  Map<String, List<String>> errors) {
        return ProblemResponse.of(kind, status, detail, request.getRequestURI(),
                clock.instant(), currentTraceId(), errors);
    }

    private static String currentTraceId() {
        String traceId = MDC.get(CorrelationIdFilter.MDC_KEY);
        return traceId != null ? traceId : UUID.randomUUID().toString();
    }
}
