package com.uptimesentinel.probes.api;

import com.uptimesentinel.probes.http.HttpProbe;
import com.uptimesentinel.probes.icmp.PingProbe;
import com.uptimesentinel.probes.tcp.TcpProbe;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Strategy table keyed by monitor protocol kind. Lookups of unregistered kinds resolve to a
 * probe that reports {@code unknown} without touching the network.
 */
public final class ProbeRegistry {
    private final Map<String, Probe> probes;

    private ProbeRegistry(Map<String, Probe> probes) {
        this.probes = Map.copyOf(probes);
    }

    public static ProbeRegistry defaults(HttpClient httpClient) {
        HttpProbe httpProbe = new HttpProbe(httpClient);
        return builder()
                .register("http", httpProbe)
                .register("https", httpProbe)
                .register("tcp", new TcpProbe())
                .register("ping", new PingProbe())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Probe resolve(String kind) {
        String key = normalize(kind);
        Probe probe = probes.get(key);
        return probe != null ? probe : new UnsupportedProbe(kind);
    }

    public boolean supports(String kind) {
        return probes.containsKey(normalize(kind));
    }

    public Set<String> kinds() {
        return probes.keySet();
    }

    private static String normalize(String kind) {
        return kind == null ? "" : kind.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<String, Probe> probes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String kind, Probe probe) {
            Objects.requireNonNull(probe, "probe is required");
            String key = normalize(kind);
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Probe kind must not be blank");
            }
            probes.put(key, probe);
            return this;
        }

        public ProbeRegistry build() {
            return new ProbeRegistry(probes);
        }
    }
}
