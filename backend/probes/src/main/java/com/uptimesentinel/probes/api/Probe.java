package com.uptimesentinel.probes.api;

import java.time.Duration;

/**
 * One protocol-specific reachability check. Implementations never throw for target-side
 * failures; those are reported as a {@code down} outcome.
 */
public interface Probe {
    ProbeOutcome probe(String target, Duration timeout);
}
