package com.uptimesentinel.service.notify.destination;

public class DeliveryException extends IllegalStateException {
    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
