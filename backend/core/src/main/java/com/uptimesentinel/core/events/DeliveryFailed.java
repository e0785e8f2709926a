package com.uptimesentinel.core.events;

import java.time.Instant;

public record DeliveryFailed(
        Instant timestamp,
        long monitorId,
        String channelName,
        String event,
        String reason
) implements Event {
    @Override
    public String type() {
        return "DeliveryFailed";
    }
}
