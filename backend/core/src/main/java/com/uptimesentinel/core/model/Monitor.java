package com.uptimesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.time.Duration;
import java.util.Objects;

/**
 * Configured probe target. {@code maxRetries} is persisted with the monitor but every tick
 * performs exactly one probe attempt.
 */
public record Monitor(
        long id,
        String name,
        @JsonAlias("url") String target,
        @JsonAlias("type") String kind,
        @JsonAlias("interval") int intervalSeconds,
        @JsonAlias("timeout") int timeoutSeconds,
        @JsonAlias("max_retries") int maxRetries,
        boolean active
) {
    public Monitor {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(target, "target is required");
        kind = kind == null || kind.isBlank() ? "http" : kind.trim();
    }

    public Duration interval() {
        return Duration.ofSeconds(intervalSeconds);
    }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public Monitor withDefaults(MonitorDefaults defaults) {
        return new Monitor(
                id,
                name,
                target,
                kind,
                intervalSeconds > 0 ? intervalSeconds : defaults.intervalSeconds(),
                timeoutSeconds > 0 ? timeoutSeconds : defaults.timeoutSeconds(),
                maxRetries > 0 ? maxRetries : defaults.maxRetries(),
                active
        );
    }
}
