package com.uptimesentinel.core.events;

import com.uptimesentinel.core.model.CheckStatus;

import java.time.Instant;

/**
 * Published whenever a freshly recorded check differs from the previously stored status.
 * This is the hand-off to live viewers.
 */
public record MonitorStatusChanged(
        Instant timestamp,
        long monitorId,
        String monitorName,
        CheckStatus previous,
        CheckStatus current
) implements Event {
    @Override
    public String type() {
        return "MonitorStatusChanged";
    }
}
