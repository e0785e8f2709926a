package com.uptimesentinel.service.notify.destination;

/**
 * Pushes one text message to an already validated destination. Implementations throw
 * {@link DeliveryException} when the backend refuses or cannot be reached.
 */
@FunctionalInterface
public interface DestinationSender {
    void send(String message);
}
