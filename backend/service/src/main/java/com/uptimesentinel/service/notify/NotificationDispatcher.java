package com.uptimesentinel.service.notify;

import com.uptimesentinel.core.bus.EventBus;
import com.uptimesentinel.core.events.DeliveryFailed;
import com.uptimesentinel.core.model.BoundChannel;
import com.uptimesentinel.core.model.Check;
import com.uptimesentinel.core.model.CheckStatus;
import com.uptimesentinel.core.model.Monitor;
import com.uptimesentinel.core.model.NotificationChannel;
import com.uptimesentinel.core.model.NotificationEvent;
import com.uptimesentinel.service.notify.destination.DeliveryException;
import com.uptimesentinel.service.notify.destination.DestinationRegistry;
import com.uptimesentinel.service.runtime.NamedThreadFactory;
import com.uptimesentinel.service.store.MonitorStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans one alert out to every channel subscribed to it. Channel resolution and each send run on
 * a bounded pool, so a tick never waits on a destination. A failed, rejected or timed out send
 * only affects its own channel.
 */
public class NotificationDispatcher implements AutoCloseable {
    static final String TEST_MESSAGE =
            "🧪 Test notification from Uptime Sentinel - Your notification channel is configured correctly!";

    private static final String QUEUE_FULL = "notification queue is full";
    private static final Logger LOGGER = Logger.getLogger(NotificationDispatcher.class.getName());

    private final MonitorStore store;
    private final DestinationRegistry destinations;
    private final AlertMessageFormatter formatter;
    private final EventBus eventBus;
    private final Clock clock;
    private final Duration sendTimeout;
    private final ThreadPoolExecutor executor;

    public NotificationDispatcher(
            MonitorStore store,
            DestinationRegistry destinations,
            AlertMessageFormatter formatter,
            EventBus eventBus,
            Clock clock,
            DispatchSettings settings
    ) {
        this.store = store;
        this.destinations = destinations;
        this.formatter = formatter;
        this.eventBus = eventBus;
        this.clock = clock;
        this.sendTimeout = settings.sendTimeout();
        this.executor = new ThreadPoolExecutor(
                settings.workers(),
                settings.workers(),
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(settings.queueCapacity()),
                new NamedThreadFactory("notify"),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * Sends {@code event} for the given check. The returned future always completes normally.
     */
    public CompletableFuture<DispatchReport> dispatch(
            Monitor monitor,
            Check check,
            NotificationEvent event,
            Optional<CheckStatus> previous
    ) {
        CompletableFuture<List<BoundChannel>> recipients;
        try {
            recipients = CompletableFuture.supplyAsync(() -> recipients(monitor.id(), event), executor);
        } catch (RejectedExecutionException e) {
            LOGGER.warning("Notification queue full, dropping " + event.id() + " for monitor " + monitor.id());
            return CompletableFuture.completedFuture(rejectAll(monitor.id(), event));
        }
        return recipients
                .thenCompose(channels -> fanOut(monitor, check, event, previous, channels))
                .exceptionally(error -> {
                    LOGGER.log(Level.WARNING, "Notification dispatch failed for monitor " + monitor.id(), unwrap(error));
                    return DispatchReport.empty(monitor.id(), event);
                });
    }

    /**
     * Enabled channels bound to the monitor whose effective subscription contains {@code event}.
     */
    public List<BoundChannel> recipients(long monitorId, NotificationEvent event) {
        List<BoundChannel> matching = new ArrayList<>();
        for (BoundChannel bound : store.channelsBoundTo(monitorId, true)) {
            if (bound.channel().enabled() && bound.subscribesTo(event)) {
                matching.add(bound);
            }
        }
        return matching;
    }

    /**
     * Validates {@code url} on the caller thread, then sends the fixed test message through the
     * same pool and timeout as real alerts.
     *
     * @throws com.uptimesentinel.service.notify.destination.InvalidDestinationException for a bad URL
     */
    public CompletableFuture<Void> sendTest(String url) {
        destinations.validate(url);
        return submitSend(url, TEST_MESSAGE);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Lookup against the in-memory catalog on the caller, so every channel that would have been
     * notified gets its own failure event.
     */
    private DispatchReport rejectAll(long monitorId, NotificationEvent event) {
        List<DispatchReport.Delivery> deliveries = new ArrayList<>();
        try {
            for (BoundChannel bound : recipients(monitorId, event)) {
                deliveries.add(failed(monitorId, event, bound.channel(), QUEUE_FULL));
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Could not resolve channels for monitor " + monitorId, e);
        }
        return new DispatchReport(monitorId, event, deliveries);
    }

    private CompletableFuture<DispatchReport> fanOut(
            Monitor monitor,
            Check check,
            NotificationEvent event,
            Optional<CheckStatus> previous,
            List<BoundChannel> channels
    ) {
        if (channels.isEmpty()) {
            LOGGER.fine("No notification channels subscribed to " + event.id() + " for monitor " + monitor.id());
            return CompletableFuture.completedFuture(DispatchReport.empty(monitor.id(), event));
        }
        String message = formatter.format(monitor, check, event, previous);
        List<CompletableFuture<DispatchReport.Delivery>> deliveries = new ArrayList<>();
        for (BoundChannel bound : channels) {
            deliveries.add(deliver(monitor.id(), event, bound.channel(), message));
        }
        return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> new DispatchReport(
                        monitor.id(),
                        event,
                        deliveries.stream().map(CompletableFuture::join).toList()
                ));
    }

    private CompletableFuture<DispatchReport.Delivery> deliver(
            long monitorId,
            NotificationEvent event,
            NotificationChannel channel,
            String message
    ) {
        return submitSend(channel.url(), message).handle((ignored, error) -> {
            if (error == null) {
                LOGGER.info("Sent " + event.id() + " for monitor " + monitorId + " to channel " + channel.name());
                return DispatchReport.Delivery.delivered(channel.name());
            }
            return failed(monitorId, event, channel, describe(unwrap(error)));
        });
    }

    private DispatchReport.Delivery failed(
            long monitorId,
            NotificationEvent event,
            NotificationChannel channel,
            String reason
    ) {
        LOGGER.warning("Failed to send " + event.id() + " for monitor " + monitorId
                + " to channel " + channel.name() + ": " + reason);
        eventBus.publish(new DeliveryFailed(clock.instant(), monitorId, channel.name(), event.id(), reason));
        return DispatchReport.Delivery.failed(channel.name(), reason);
    }

    /**
     * Queues one send. The timeout starts when a worker picks the send up, not when it is queued.
     */
    private CompletableFuture<Void> submitSend(String url, String message) {
        SendAttempt attempt = new SendAttempt(url, message);
        try {
            executor.execute(attempt);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new DeliveryException(QUEUE_FULL, e));
        }
        return attempt.result;
    }

    private String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "send timed out after " + sendTimeout.toMillis() + "ms";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private final class SendAttempt implements Runnable {
        private final String url;
        private final String message;
        private final CompletableFuture<Void> result = new CompletableFuture<>();
        private Thread worker;

        private SendAttempt(String url, String message) {
            this.url = url;
            this.message = message;
        }

        @Override
        public void run() {
            synchronized (this) {
                worker = Thread.currentThread();
            }
            CompletableFuture.delayedExecutor(sendTimeout.toMillis(), TimeUnit.MILLISECONDS).execute(this::expire);
            try {
                destinations.createSender(url).send(message);
                result.complete(null);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            } finally {
                synchronized (this) {
                    worker = null;
                }
            }
        }

        // interrupts the worker so an abandoned send stops holding it
        private void expire() {
            if (result.completeExceptionally(new TimeoutException())) {
                synchronized (this) {
                    if (worker != null) {
                        worker.interrupt();
                    }
                }
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
