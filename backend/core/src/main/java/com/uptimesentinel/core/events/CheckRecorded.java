package com.uptimesentinel.core.events;

import com.uptimesentinel.core.model.CheckStatus;

import java.time.Instant;

public record CheckRecorded(
        Instant timestamp,
        long monitorId,
        String monitorName,
        CheckStatus status,
        long latencyMillis,
        Integer statusCode,
        String message
) implements Event {
    @Override
    public String type() {
        return "CheckRecorded";
    }
}
