package com.uptimesentinel.core.events;

import java.time.Instant;

public record TickFailed(
        Instant timestamp,
        long monitorId,
        String message
) implements Event {
    @Override
    public String type() {
        return "TickFailed";
    }
}
