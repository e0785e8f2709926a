package com.uptimesentinel.service.config;

import com.uptimesentinel.core.model.MonitorDefaults;
import com.uptimesentinel.service.notify.DispatchSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Process-wide settings. {@code slowResponseThresholdMillis} of zero disables slow-response
 * alerts.
 */
public record ServiceSettings(
        String host,
        int port,
        long slowResponseThresholdMillis,
        MonitorDefaults monitorDefaults,
        DispatchSettings dispatch,
        Duration httpConnectTimeout,
        ZoneId zone,
        Path checkLog
) {
    public static final int DEFAULT_PORT = 8080;
    public static final long DEFAULT_SLOW_RESPONSE_THRESHOLD_MILLIS = 5_000;

    public ServiceSettings {
        Objects.requireNonNull(host, "host is required");
        Objects.requireNonNull(monitorDefaults, "monitorDefaults is required");
        Objects.requireNonNull(dispatch, "dispatch is required");
        Objects.requireNonNull(httpConnectTimeout, "httpConnectTimeout is required");
        Objects.requireNonNull(zone, "zone is required");
        Objects.requireNonNull(checkLog, "checkLog is required");
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (slowResponseThresholdMillis < 0) {
            throw new IllegalArgumentException("slowResponseThresholdMillis must not be negative");
        }
    }

    public static ServiceSettings defaults() {
        return new ServiceSettings(
                "0.0.0.0",
                DEFAULT_PORT,
                DEFAULT_SLOW_RESPONSE_THRESHOLD_MILLIS,
                MonitorDefaults.STANDARD,
                DispatchSettings.DEFAULTS,
                Duration.ofSeconds(10),
                ZoneId.of("UTC"),
                Path.of("data", "checks.jsonl")
        );
    }

    ServiceSettings withPort(int value) {
        return new ServiceSettings(host, value, slowResponseThresholdMillis, monitorDefaults, dispatch,
                httpConnectTimeout, zone, checkLog);
    }

    ServiceSettings withSlowResponseThresholdMillis(long value) {
        return new ServiceSettings(host, port, value, monitorDefaults, dispatch, httpConnectTimeout, zone, checkLog);
    }

    ServiceSettings withMonitorDefaults(MonitorDefaults value) {
        return new ServiceSettings(host, port, slowResponseThresholdMillis, value, dispatch, httpConnectTimeout,
                zone, checkLog);
    }

    ServiceSettings withCheckLog(Path value) {
        return new ServiceSettings(host, port, slowResponseThresholdMillis, monitorDefaults, dispatch,
                httpConnectTimeout, zone, value);
    }
}
