package com.uptimesentinel.core.classify;

import com.uptimesentinel.core.model.CheckStatus;
import com.uptimesentinel.core.model.NotificationEvent;

import java.util.Objects;
import java.util.Optional;

/**
 * Maps two consecutive check states to the event that should be alerted on, if any.
 * Rules are evaluated in order and the first match wins:
 * <ol>
 *     <li>down to up: {@link NotificationEvent#RECOVERY}</li>
 *     <li>up to down: {@link NotificationEvent#DOWN}</li>
 *     <li>unknown to up: {@link NotificationEvent#UP}</li>
 *     <li>unknown to down: {@link NotificationEvent#DOWN}</li>
 *     <li>up with a positive threshold exceeded: {@link NotificationEvent#SLOW}</li>
 * </ol>
 * Anything else, including every transition that ends in {@code unknown}, yields no event.
 */
public final class EventClassifier {
    private EventClassifier() {
    }

    public static Optional<NotificationEvent> classify(
            CheckStatus current,
            CheckStatus previous,
            long latencyMillis,
            long slowThresholdMillis
    ) {
        Objects.requireNonNull(current, "current is required");
        Objects.requireNonNull(previous, "previous is required");

        if (previous == CheckStatus.DOWN && current == CheckStatus.UP) {
            return Optional.of(NotificationEvent.RECOVERY);
        }
        if (previous == CheckStatus.UP && current == CheckStatus.DOWN) {
            return Optional.of(NotificationEvent.DOWN);
        }
        if (previous == CheckStatus.UNKNOWN && current == CheckStatus.UP) {
            return Optional.of(NotificationEvent.UP);
        }
        if (previous == CheckStatus.UNKNOWN && current == CheckStatus.DOWN) {
            return Optional.of(NotificationEvent.DOWN);
        }
        if (current == CheckStatus.UP && slowThresholdMillis > 0 && latencyMillis > slowThresholdMillis) {
            return Optional.of(NotificationEvent.SLOW);
        }
        return Optional.empty();
    }
}
