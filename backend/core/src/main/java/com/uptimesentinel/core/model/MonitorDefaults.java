package com.uptimesentinel.core.model;

public record MonitorDefaults(int intervalSeconds, int timeoutSeconds, int maxRetries) {
    public static final MonitorDefaults STANDARD = new MonitorDefaults(60, 30, 3);

    public MonitorDefaults {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be positive");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
    }
}
