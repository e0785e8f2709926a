package com.uptimesentinel.probes.api;

import com.uptimesentinel.core.model.CheckStatus;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Result of a single probe. {@code measuredLatencyMillis} is only set by probes that measure
 * latency themselves; otherwise the caller records the wall-clock duration of the call.
 */
public record ProbeOutcome(CheckStatus status, Integer statusCode, String message, Long measuredLatencyMillis) {
    public ProbeOutcome {
        Objects.requireNonNull(status, "status is required");
        message = message == null ? "" : message;
    }

    public static ProbeOutcome up(String message) {
        return new ProbeOutcome(CheckStatus.UP, null, message, null);
    }

    public static ProbeOutcome up(int statusCode, String message) {
        return new ProbeOutcome(CheckStatus.UP, statusCode, message, null);
    }

    public static ProbeOutcome down(String message) {
        return new ProbeOutcome(CheckStatus.DOWN, null, message, null);
    }

    public static ProbeOutcome down(int statusCode, String message) {
        return new ProbeOutcome(CheckStatus.DOWN, statusCode, message, null);
    }

    public static ProbeOutcome unknown(String message) {
        return new ProbeOutcome(CheckStatus.UNKNOWN, null, message, null);
    }

    public ProbeOutcome withMeasuredLatency(long latencyMillis) {
        return new ProbeOutcome(status, statusCode, message, latencyMillis);
    }

    public OptionalLong measuredLatency() {
        return measuredLatencyMillis == null ? OptionalLong.empty() : OptionalLong.of(measuredLatencyMillis);
    }
}
