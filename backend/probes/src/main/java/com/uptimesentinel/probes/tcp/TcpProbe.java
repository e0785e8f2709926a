package com.uptimesentinel.probes.tcp;

import com.uptimesentinel.probes.api.Probe;
import com.uptimesentinel.probes.api.ProbeOutcome;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Opens and immediately closes a TCP connection. A malformed target is reported as down.
 */
public class TcpProbe implements Probe {
    @Override
    public ProbeOutcome probe(String target, Duration timeout) {
        TcpAddress address;
        try {
            address = TcpAddress.parse(target);
        } catch (IllegalArgumentException e) {
            return ProbeOutcome.down(e.getMessage());
        }

        int timeoutMillis = (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(address.host(), address.port()), timeoutMillis);
            return ProbeOutcome.up("TCP connection successful to " + address);
        } catch (IOException e) {
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return ProbeOutcome.down("TCP connection failed to " + address + ": " + reason);
        }
    }
}
