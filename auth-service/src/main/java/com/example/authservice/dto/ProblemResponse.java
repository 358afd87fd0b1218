package com.example.authservice.dto;

import com.example.authservice.exception.ErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Error envelope for every non-2xx response, served as application/problem+json.
 * errors is only present for field validation failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemResponse(
    @JsonProperty("type")
    String type,

    @JsonProperty("kind")
    String kind,

    @JsonProperty("title")
    String title,

    @JsonProperty("status")
    int status,

    @JsonProperty("detail")
    String detail,

    @JsonProperty("instance")
    String instance,

    @JsonProperty("timestamp")
    Instant timestamp,

    @JsonProperty("traceId")
    String traceId,

    @JsonProperty("errors")
    Map<String, List<String>> errors
) {
    public static ProblemResponse of(ErrorKind kind, int status, String detail,
                                     String instance, Instant timestamp, String traceId) {
        return of(kind, status, detail, instance, timestamp, traceId, null);
    }

    public static ProblemResponse of(ErrorKind kind, int status, String detail, String instance,
                                     Instant timestamp, String traceId, Map<String, List<String>> errors) {
        return new ProblemResponse(kind.getType(), kind.getKindName(), kind.getTitle(), status,
                detail, instance, timestamp, traceId, errors);
    }
}
