package com.uptimesentinel.probes.icmp;

import java.io.IOException;
import java.net.InetAddress;

/**
 * Sends one echo request and waits at most {@code timeoutMillis} for the reply.
 */
@FunctionalInterface
public interface EchoRequester {
    EchoRequester UNPRIVILEGED = InetAddress::isReachable;

    boolean echo(InetAddress address, int timeoutMillis) throws IOException;
}
