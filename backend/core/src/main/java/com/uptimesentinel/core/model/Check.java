package com.uptimesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * One timestamped observation of a monitor. {@code statusCode} is only set by protocols that
 * report one (HTTP).
 */
public record Check(
        long monitorId,
        CheckStatus status,
        long latencyMillis,
        @JsonInclude(JsonInclude.Include.NON_NULL) Integer statusCode,
        String message,
        Instant checkedAt
) {
    public Check {
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(checkedAt, "checkedAt is required");
        message = message == null ? "" : message;
    }
}
