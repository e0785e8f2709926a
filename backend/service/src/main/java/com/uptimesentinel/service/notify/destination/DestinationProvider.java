package com.uptimesentinel.service.notify.destination;

import java.net.URI;

/**
 * One provider family, selected by the destination URL scheme.
 */
public interface DestinationProvider {
    ServiceInfo info();

    /**
     * Parses the destination and returns a sender for it. Must not perform any I/O.
     *
     * @throws InvalidDestinationException when the URL is missing parts the provider needs
     */
    DestinationSender create(URI destination);

    default String scheme() {
        return info().scheme();
    }
}
