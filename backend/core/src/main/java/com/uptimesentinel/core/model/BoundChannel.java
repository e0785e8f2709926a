package com.uptimesentinel.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A channel as seen from one monitor: the channel itself plus the binding-level override.
 */
public record BoundChannel(NotificationChannel channel, Optional<Set<NotificationEvent>> eventOverride) {
    public BoundChannel {
        Objects.requireNonNull(channel, "channel is required");
        eventOverride = eventOverride == null ? Optional.empty() : eventOverride;
    }

    public static BoundChannel of(NotificationChannel channel, ChannelBinding binding) {
        return new BoundChannel(channel, binding.eventOverride());
    }

    public Set<NotificationEvent> effectiveEvents() {
        return eventOverride.orElseGet(channel::subscription);
    }

    public boolean subscribesTo(NotificationEvent event) {
        return effectiveEvents().contains(event);
    }
}
