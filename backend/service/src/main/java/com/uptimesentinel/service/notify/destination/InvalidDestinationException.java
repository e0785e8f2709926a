package com.uptimesentinel.service.notify.destination;

public class InvalidDestinationException extends IllegalArgumentException {
    public InvalidDestinationException(String message) {
        super(message);
    }

    public InvalidDestinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
