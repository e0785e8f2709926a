package com.uptimesentinel.core.model;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Association of a monitor with a channel. A non-empty {@code events} set replaces the
 * channel's own subscription for this monitor only.
 */
public record ChannelBinding(long monitorId, long channelId, Set<NotificationEvent> events) {
    public ChannelBinding {
        events = events == null || events.isEmpty() ? null : Set.copyOf(EnumSet.copyOf(events));
    }

    public Optional<Set<NotificationEvent>> eventOverride() {
        return Optional.ofNullable(events);
    }
}
