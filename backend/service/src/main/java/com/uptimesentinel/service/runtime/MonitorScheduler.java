package com.uptimesentinel.service.runtime;

import com.uptimesentinel.core.bus.EventBus;
import com.uptimesentinel.core.events.TickFailed;
import com.uptimesentinel.core.model.Monitor;
import com.uptimesentinel.service.store.MonitorStore;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns one fixed-rate timer per monitor. The single timer thread only hands ticks to a worker
 * pool, so a slow probe never delays another monitor. A tick that fires while another tick for
 * the same monitor id is still running is skipped, including one started by a job that has
 * since been replaced.
 *
 * <p>Lifecycle is {@code start()} once, any number of {@code addMonitor}/{@code removeMonitor},
 * then {@code stop()}. A stopped scheduler cannot be restarted.
 */
public class MonitorScheduler {
    private static final Logger LOGGER = Logger.getLogger(MonitorScheduler.class.getName());

    private final MonitorStore store;
    private final Consumer<Monitor> tick;
    private final EventBus eventBus;
    private final Clock clock;
    private final long minIntervalMillis;
    private final ReentrantLock registryLock = new ReentrantLock();
    private final Map<Long, ScheduledJob> jobs = new HashMap<>();
    // never pruned: a re-added id must still see a tick left running by its removed job
    private final Map<Long, AtomicBoolean> inFlight = new HashMap<>();
    private final ScheduledExecutorService timerExecutor =
            Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("monitor-timer"));
    private final ExecutorService checkExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("monitor-check"));
    private boolean stopped;

    public MonitorScheduler(MonitorStore store, MonitorChecker checker, EventBus eventBus, Clock clock) {
        this(store, checker::check, eventBus, clock, 1_000);
    }

    MonitorScheduler(MonitorStore store, Consumer<Monitor> tick, EventBus eventBus, Clock clock, long minIntervalMillis) {
        this.store = store;
        this.tick = tick;
        this.eventBus = eventBus;
        this.clock = clock;
        this.minIntervalMillis = minIntervalMillis;
    }

    /**
     * Installs a timer for every active monitor in the store. A monitor that cannot be scheduled
     * is logged and skipped.
     */
    public void start() {
        List<Monitor> monitors = store.listActiveMonitors();
        int installed = 0;
        for (Monitor monitor : monitors) {
            try {
                addMonitor(monitor);
                installed++;
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Failed to schedule monitor " + monitor.id(), e);
            }
        }
        LOGGER.info("Monitor scheduler started with " + installed + " of " + monitors.size() + " active monitors");
    }

    public void stop() {
        registryLock.lock();
        try {
            if (stopped) {
                return;
            }
            stopped = true;
            jobs.values().forEach(ScheduledJob::cancel);
            jobs.clear();
        } finally {
            registryLock.unlock();
        }
        timerExecutor.shutdownNow();
        checkExecutor.shutdown();
        try {
            if (!checkExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                checkExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            checkExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Monitor scheduler stopped");
    }

    /**
     * Installs the timer for {@code monitor}, cancelling any job already registered for its id.
     * The first tick fires one interval from now.
     */
    public ScheduledJob addMonitor(Monitor monitor) {
        Objects.requireNonNull(monitor, "monitor is required");
        long intervalMillis = Math.max(minIntervalMillis, monitor.interval().toMillis());
        registryLock.lock();
        try {
            if (stopped) {
                throw new IllegalStateException("Monitor scheduler is stopped");
            }
            ScheduledJob previous = jobs.remove(monitor.id());
            if (previous != null) {
                previous.cancel();
            }
            ScheduledJob job = new ScheduledJob(
                    monitor,
                    inFlight.computeIfAbsent(monitor.id(), ignored -> new AtomicBoolean())
            );
            ScheduledFuture<?> timer = timerExecutor.scheduleAtFixedRate(
                    () -> enqueue(job),
                    intervalMillis,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
            job.attach(timer);
            jobs.put(monitor.id(), job);
            LOGGER.info((previous == null ? "Scheduled" : "Rescheduled") + " monitor " + monitor.name()
                    + " (" + monitor.id() + ") every " + intervalMillis + "ms");
            return job;
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Cancels and forgets the job for {@code monitorId}. Unknown ids are ignored.
     */
    public boolean removeMonitor(long monitorId) {
        registryLock.lock();
        try {
            ScheduledJob job = jobs.remove(monitorId);
            if (job == null) {
                return false;
            }
            job.cancel();
            LOGGER.info("Unscheduled monitor " + monitorId);
            return true;
        } finally {
            registryLock.unlock();
        }
    }

    public Set<Long> scheduledMonitorIds() {
        registryLock.lock();
        try {
            return new TreeSet<>(jobs.keySet());
        } finally {
            registryLock.unlock();
        }
    }

    public Optional<ScheduledJob> job(long monitorId) {
        registryLock.lock();
        try {
            return Optional.ofNullable(jobs.get(monitorId));
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Runs one tick for a scheduled monitor on the calling thread. Returns false when the monitor
     * is not scheduled or its previous tick is still running.
     */
    public boolean checkNow(long monitorId) {
        Optional<ScheduledJob> job = job(monitorId);
        return job.isPresent() && runTick(job.get());
    }

    private void enqueue(ScheduledJob job) {
        if (job.isCancelled()) {
            return;
        }
        try {
            checkExecutor.execute(() -> runTick(job));
        } catch (RejectedExecutionException e) {
            LOGGER.fine("Tick for monitor " + job.monitor().id() + " rejected, scheduler is shutting down");
        }
    }

    private boolean runTick(ScheduledJob job) {
        Monitor monitor = job.monitor();
        if (job.isCancelled()) {
            return false;
        }
        if (!job.tryBegin()) {
            LOGGER.fine("Skipping tick for monitor " + monitor.id() + ", previous tick still running");
            return false;
        }
        try {
            tick.accept(monitor);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Tick failed for monitor " + monitor.id(), e);
            eventBus.publish(new TickFailed(clock.instant(), monitor.id(), describe(e)));
        } finally {
            job.finish();
        }
        return true;
    }

    private static String describe(RuntimeException error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
