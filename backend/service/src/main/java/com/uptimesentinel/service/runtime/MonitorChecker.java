package com.uptimesentinel.service.runtime;

import com.uptimesentinel.core.bus.EventBus;
import com.uptimesentinel.core.classify.EventClassifier;
import com.uptimesentinel.core.events.CheckRecorded;
import com.uptimesentinel.core.events.MonitorStatusChanged;
import com.uptimesentinel.core.model.Check;
import com.uptimesentinel.core.model.CheckStatus;
import com.uptimesentinel.core.model.Monitor;
import com.uptimesentinel.core.model.NotificationEvent;
import com.uptimesentinel.probes.api.ProbeOutcome;
import com.uptimesentinel.probes.api.ProbeRegistry;
import com.uptimesentinel.service.notify.NotificationDispatcher;
import com.uptimesentinel.service.store.MonitorStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One tick: probe, read the previous status, record the check, classify, hand off to the
 * dispatcher. Dispatch is not awaited.
 */
public class MonitorChecker {
    private static final Logger LOGGER = Logger.getLogger(MonitorChecker.class.getName());

    private final ProbeRegistry probes;
    private final MonitorStore store;
    private final NotificationDispatcher dispatcher;
    private final EventBus eventBus;
    private final Clock clock;
    private final long slowThresholdMillis;
    private final LongSupplier nanoTime;

    public MonitorChecker(
            ProbeRegistry probes,
            MonitorStore store,
            NotificationDispatcher dispatcher,
            EventBus eventBus,
            Clock clock,
            long slowThresholdMillis
    ) {
        this(probes, store, dispatcher, eventBus, clock, slowThresholdMillis, System::nanoTime);
    }

    MonitorChecker(
            ProbeRegistry probes,
            MonitorStore store,
            NotificationDispatcher dispatcher,
            EventBus eventBus,
            Clock clock,
            long slowThresholdMillis,
            LongSupplier nanoTime
    ) {
        this.probes = probes;
        this.store = store;
        this.dispatcher = dispatcher;
        this.eventBus = eventBus;
        this.clock = clock;
        this.slowThresholdMillis = slowThresholdMillis;
        this.nanoTime = nanoTime;
    }

    /**
     * Runs one check for {@code monitor}. Returns the recorded check, or empty when it could not
     * be persisted, in which case nothing is classified or sent.
     */
    public Optional<Check> check(Monitor monitor) {
        Instant checkedAt = clock.instant();
        long startedAt = nanoTime.getAsLong();
        ProbeOutcome outcome = probes.resolve(monitor.kind()).probe(monitor.target(), monitor.timeout());
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(nanoTime.getAsLong() - startedAt);
        long latencyMillis = outcome.measuredLatency().orElse(elapsedMillis);

        Check check = new Check(
                monitor.id(),
                outcome.status(),
                latencyMillis,
                outcome.statusCode(),
                outcome.message(),
                checkedAt
        );

        Optional<CheckStatus> previous = previousStatus(monitor);
        try {
            store.insertCheck(check);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed to save check for monitor " + monitor.id() + ", dropping it", e);
            return Optional.empty();
        }

        eventBus.publish(new CheckRecorded(
                checkedAt,
                monitor.id(),
                monitor.name(),
                check.status(),
                latencyMillis,
                check.statusCode(),
                check.message()
        ));
        CheckStatus prior = previous.orElse(CheckStatus.UNKNOWN);
        if (prior != check.status()) {
            eventBus.publish(new MonitorStatusChanged(checkedAt, monitor.id(), monitor.name(), prior, check.status()));
        }

        Optional<NotificationEvent> event =
                EventClassifier.classify(check.status(), prior, latencyMillis, slowThresholdMillis);
        if (event.isPresent()) {
            LOGGER.info("Monitor " + monitor.name() + " (" + monitor.id() + "): " + event.get().id()
                    + ", " + prior + " -> " + check.status());
            dispatcher.dispatch(monitor, check, event.get(), previous);
        } else {
            LOGGER.fine("Monitor " + monitor.id() + " checked: " + check.status() + " in " + latencyMillis + "ms");
        }
        return Optional.of(check);
    }

    private Optional<CheckStatus> previousStatus(Monitor monitor) {
        try {
            return store.latestStatus(monitor.id());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed to read previous status for monitor " + monitor.id()
                    + ", treating it as unknown", e);
            return Optional.empty();
        }
    }
}
