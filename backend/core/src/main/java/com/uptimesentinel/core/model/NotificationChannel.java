package com.uptimesentinel.core.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Named destination. The URL is opaque to the core and encodes provider, credentials and
 * recipient. An empty event set means {@link NotificationEvent#DEFAULT_SUBSCRIPTION}.
 */
public record NotificationChannel(
        long id,
        String name,
        String url,
        Set<NotificationEvent> events,
        boolean enabled
) {
    public NotificationChannel {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(url, "url is required");
        events = events == null || events.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(events));
    }

    public Set<NotificationEvent> subscription() {
        return events.isEmpty() ? NotificationEvent.DEFAULT_SUBSCRIPTION : events;
    }
}
