package com.uptimesentinel.service.runtime;

import com.uptimesentinel.core.model.Monitor;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live timer for one monitor. Holds the monitor snapshot taken when the job was installed; a
 * later edit replaces the whole job rather than mutating this one. The in-flight flag belongs to
 * the monitor id and is shared with any job that replaces this one.
 */
public final class ScheduledJob {
    private final Monitor monitor;
    private final AtomicBoolean running;
    private final AtomicLong completedTicks = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();
    private volatile ScheduledFuture<?> timer;
    private volatile boolean cancelled;

    ScheduledJob(Monitor monitor, AtomicBoolean running) {
        this.monitor = monitor;
        this.running = running;
    }

    public Monitor monitor() {
        return monitor;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isRunning() {
        return running.get();
    }

    public long completedTicks() {
        return completedTicks.get();
    }

    public long skippedTicks() {
        return skippedTicks.get();
    }

    void attach(ScheduledFuture<?> timer) {
        this.timer = timer;
    }

    void cancel() {
        cancelled = true;
        ScheduledFuture<?> current = timer;
        if (current != null) {
            current.cancel(false);
        }
    }

    boolean tryBegin() {
        if (running.compareAndSet(false, true)) {
            return true;
        }
        skippedTicks.incrementAndGet();
        return false;
    }

    void finish() {
        completedTicks.incrementAndGet();
        running.set(false);
    }
}
