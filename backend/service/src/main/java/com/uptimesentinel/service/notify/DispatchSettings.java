package com.uptimesentinel.service.notify;

import java.time.Duration;

/**
 * Sizing of the notification pool. {@code queueCapacity} bounds the sends waiting for a worker;
 * anything beyond it is rejected and reported as failed.
 */
public record DispatchSettings(int workers, int queueCapacity, Duration sendTimeout) {
    public static final DispatchSettings DEFAULTS = new DispatchSettings(4, 256, Duration.ofSeconds(10));

    public DispatchSettings {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be positive");
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        if (sendTimeout == null || sendTimeout.isNegative() || sendTimeout.isZero()) {
            throw new IllegalArgumentException("sendTimeout must be positive");
        }
    }
}
