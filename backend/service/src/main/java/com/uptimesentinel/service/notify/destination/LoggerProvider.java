package com.uptimesentinel.service.notify.destination;

import java.net.URI;
import java.util.logging.Logger;

/**
 * {@code logger://} writes alerts to the application log, handy for local runs.
 */
public class LoggerProvider implements DestinationProvider {
    private static final Logger LOGGER = Logger.getLogger(LoggerProvider.class.getName());
    private static final ServiceInfo INFO = new ServiceInfo(
            "Logger",
            "logger",
            "logger://",
            "logger://",
            "Writes notifications to the service log"
    );

    @Override
    public ServiceInfo info() {
        return INFO;
    }

    @Override
    public DestinationSender create(URI destination) {
        return message -> LOGGER.info("Notification:\n" + message);
    }
}
