package com.uptimesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Alert-worthy transition between two consecutive checks of a monitor.
 * Wire ids match the values stored in channel and binding subscriptions.
 */
public enum NotificationEvent {
    UP("monitor_up", "up", "✅", "Monitor UP"),
    DOWN("monitor_down", "down", "🔴", "Monitor DOWN"),
    RECOVERY("recovery", "recovered", "🔄", "Monitor Recovered"),
    SLOW("response_slow", "slow", "🐢", "Slow Response");

    /**
     * Subscription applied to channels that list no events. Never includes {@link #SLOW}.
     */
    public static final Set<NotificationEvent> DEFAULT_SUBSCRIPTION =
            Collections.unmodifiableSet(EnumSet.of(UP, DOWN, RECOVERY));

    private final String id;
    private final String alias;
    private final String emoji;
    private final String title;

    NotificationEvent(String id, String alias, String emoji, String title) {
        this.id = id;
        this.alias = alias;
        this.emoji = emoji;
        this.title = title;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String emoji() {
        return emoji;
    }

    public String title() {
        return title;
    }

    @JsonCreator
    public static NotificationEvent fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Notification event is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (NotificationEvent event : values()) {
            if (event.id.equals(normalized)
                    || event.alias.equals(normalized)
                    || event.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return event;
            }
        }
        throw new IllegalArgumentException("Unknown notification event: " + raw);
    }

    @Override
    public String toString() {
        return id;
    }
}
