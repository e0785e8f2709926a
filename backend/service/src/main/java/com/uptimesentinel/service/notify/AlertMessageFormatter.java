package com.uptimesentinel.service.notify;

import com.uptimesentinel.core.model.Check;
import com.uptimesentinel.core.model.CheckStatus;
import com.uptimesentinel.core.model.Monitor;
import com.uptimesentinel.core.model.NotificationEvent;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

/**
 * Renders the plain-text alert body shared by every destination.
 */
public final class AlertMessageFormatter {
    private static final DateTimeFormatter CHECKED_AT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z", Locale.ROOT);

    private final ZoneId zone;

    public AlertMessageFormatter(ZoneId zone) {
        this.zone = zone;
    }

    public String format(Monitor monitor, Check check, NotificationEvent event, Optional<CheckStatus> previous) {
        StringBuilder message = new StringBuilder();
        message.append(event.emoji()).append(' ').append(event.title()).append(": ").append(monitor.name()).append('\n');
        message.append("URL: ").append(monitor.target()).append('\n');

        message.append("Status: ");
        if (previous.isPresent() && previous.get() != check.status()) {
            message.append(previous.get()).append(" → ");
        }
        message.append(check.status()).append('\n');

        if (check.latencyMillis() > 0) {
            message.append("Response Time: ").append(check.latencyMillis()).append("ms\n");
        }
        if (!check.message().isEmpty()) {
            message.append("Message: ").append(check.message()).append('\n');
        }
        message.append("Checked: ").append(CHECKED_AT.format(check.checkedAt().atZone(zone)));
        return message.toString();
    }
}
