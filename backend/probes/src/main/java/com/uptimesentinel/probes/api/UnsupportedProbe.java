package com.uptimesentinel.probes.api;

import java.time.Duration;

final class UnsupportedProbe implements Probe {
    private final String kind;

    UnsupportedProbe(String kind) {
        this.kind = kind;
    }

    @Override
    public ProbeOutcome probe(String target, Duration timeout) {
        return ProbeOutcome.unknown("Unknown monitor type: " + kind);
    }
}
