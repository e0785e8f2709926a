package com.uptimesentinel.service.store;

import com.uptimesentinel.core.model.BoundChannel;
import com.uptimesentinel.core.model.ChannelBinding;
import com.uptimesentinel.core.model.Check;
import com.uptimesentinel.core.model.CheckStatus;
import com.uptimesentinel.core.model.Monitor;
import com.uptimesentinel.core.model.NotificationChannel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.ToLongFunction;

/**
 * In-memory catalog of monitors, channels and bindings, loaded from configuration. Checks are
 * delegated to a {@link CheckLog}. Removing a monitor or a channel drops its bindings.
 */
public class CatalogMonitorStore implements MonitorStore {
    private final Map<Long, Monitor> monitors = new ConcurrentHashMap<>();
    private final Map<Long, NotificationChannel> channels = new ConcurrentHashMap<>();
    private final List<ChannelBinding> bindings = new CopyOnWriteArrayList<>();
    private final CheckLog checkLog;

    public CatalogMonitorStore(CheckLog checkLog) {
        this.checkLog = Objects.requireNonNull(checkLog, "checkLog is required");
    }

    public void putMonitor(Monitor monitor) {
        monitors.put(monitor.id(), monitor);
    }

    public Optional<Monitor> removeMonitor(long monitorId) {
        Monitor removed = monitors.remove(monitorId);
        bindings.removeIf(binding -> binding.monitorId() == monitorId);
        return Optional.ofNullable(removed);
    }

    public Optional<Monitor> monitor(long monitorId) {
        return Optional.ofNullable(monitors.get(monitorId));
    }

    public List<Monitor> monitors() {
        return sortedById(monitors.values(), Monitor::id);
    }

    public void putChannel(NotificationChannel channel) {
        channels.put(channel.id(), channel);
    }

    public Optional<NotificationChannel> removeChannel(long channelId) {
        NotificationChannel removed = channels.remove(channelId);
        bindings.removeIf(binding -> binding.channelId() == channelId);
        return Optional.ofNullable(removed);
    }

    public Optional<NotificationChannel> channel(long channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    public List<NotificationChannel> channels() {
        return sortedById(channels.values(), NotificationChannel::id);
    }

    /**
     * Installs or replaces the binding for the (monitor, channel) pair.
     */
    public synchronized void bind(ChannelBinding binding) {
        if (!monitors.containsKey(binding.monitorId())) {
            throw new IllegalArgumentException("Unknown monitor id " + binding.monitorId());
        }
        if (!channels.containsKey(binding.channelId())) {
            throw new IllegalArgumentException("Unknown channel id " + binding.channelId());
        }
        bindings.removeIf(existing -> sameLink(existing, binding.monitorId(), binding.channelId()));
        bindings.add(binding);
    }

    public synchronized boolean unbind(long monitorId, long channelId) {
        return bindings.removeIf(existing -> sameLink(existing, monitorId, channelId));
    }

    public Optional<Check> latestCheck(long monitorId) {
        return checkLog.latest(monitorId);
    }

    public List<Check> recentChecks(long monitorId, int limit) {
        return checkLog.recent(monitorId, limit);
    }

    @Override
    public List<Monitor> listActiveMonitors() {
        return monitors().stream().filter(Monitor::active).toList();
    }

    @Override
    public void insertCheck(Check check) {
        checkLog.append(check);
    }

    @Override
    public Optional<CheckStatus> latestStatus(long monitorId) {
        return checkLog.latest(monitorId).map(Check::status);
    }

    @Override
    public List<BoundChannel> channelsBoundTo(long monitorId, boolean enabledOnly) {
        List<BoundChannel> bound = new ArrayList<>();
        for (ChannelBinding binding : bindings) {
            if (binding.monitorId() != monitorId) {
                continue;
            }
            NotificationChannel channel = channels.get(binding.channelId());
            if (channel == null || (enabledOnly && !channel.enabled())) {
                continue;
            }
            bound.add(BoundChannel.of(channel, binding));
        }
        bound.sort(Comparator.comparingLong(entry -> entry.channel().id()));
        return bound;
    }

    private static boolean sameLink(ChannelBinding binding, long monitorId, long channelId) {
        return binding.monitorId() == monitorId && binding.channelId() == channelId;
    }

    private static <T> List<T> sortedById(Collection<T> values, ToLongFunction<T> id) {
        List<T> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.comparingLong(id));
        return sorted;
    }
}
