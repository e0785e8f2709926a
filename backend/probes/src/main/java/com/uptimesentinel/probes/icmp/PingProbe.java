package com.uptimesentinel.probes.icmp;

import com.uptimesentinel.probes.api.Probe;
import com.uptimesentinel.probes.api.ProbeOutcome;

import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends {@value #PACKET_COUNT} echo requests that share one deadline equal to the monitor
 * timeout. Reported latency is the average round trip of the replies received.
 */
public class PingProbe implements Probe {
    public static final int PACKET_COUNT = 3;
    private static final Logger LOGGER = Logger.getLogger(PingProbe.class.getName());

    private final EchoRequester echoRequester;
    private final HostResolver resolver;
    private final LongSupplier nanoTime;

    public PingProbe() {
        this(EchoRequester.UNPRIVILEGED, InetAddress::getByName, System::nanoTime);
    }

    public PingProbe(EchoRequester echoRequester, HostResolver resolver, LongSupplier nanoTime) {
        this.echoRequester = echoRequester;
        this.resolver = resolver;
        this.nanoTime = nanoTime;
    }

    @Override
    public ProbeOutcome probe(String target, Duration timeout) {
        String host = hostOf(target);
        if (host.isEmpty()) {
            return ProbeOutcome.down("no host specified in " + target);
        }

        InetAddress address;
        try {
            address = resolver.resolve(host);
        } catch (UnknownHostException e) {
            return ProbeOutcome.down("unknown host " + host);
        }

        long deadline = nanoTime.getAsLong() + timeout.toNanos();
        long totalRttNanos = 0;
        int received = 0;
        for (int sent = 0; sent < PACKET_COUNT; sent++) {
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - nanoTime.getAsLong());
            if (remainingMillis <= 0) {
                break;
            }
            long startedAt = nanoTime.getAsLong();
            try {
                if (echoRequester.echo(address, (int) Math.min(Integer.MAX_VALUE, remainingMillis))) {
                    totalRttNanos += nanoTime.getAsLong() - startedAt;
                    received++;
                }
            } catch (IOException e) {
                LOGGER.log(Level.FINE, "Echo request to " + host + " failed", e);
            }
        }

        if (received == 0) {
            return ProbeOutcome.down("no packets received");
        }
        long averageMillis = TimeUnit.NANOSECONDS.toMillis(totalRttNanos / received);
        return ProbeOutcome.up("Ping successful, avg RTT: " + averageMillis + "ms (" + received + "/" + PACKET_COUNT + " replies)")
                .withMeasuredLatency(averageMillis);
    }

    static String hostOf(String target) {
        String raw = target == null ? "" : target.trim();
        if (!raw.contains("://")) {
            return raw;
        }
        try {
            URI uri = URI.create(raw);
            if (uri.getHost() != null) {
                return uri.getHost();
            }
            String authority = uri.getAuthority();
            return authority == null ? "" : authority;
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    @FunctionalInterface
    public interface HostResolver {
        InetAddress resolve(String host) throws UnknownHostException;
    }
}
