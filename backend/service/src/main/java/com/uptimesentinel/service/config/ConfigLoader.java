package com.uptimesentinel.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.uptimesentinel.core.model.ChannelBinding;
import com.uptimesentinel.core.model.Monitor;
import com.uptimesentinel.core.model.MonitorDefaults;
import com.uptimesentinel.core.model.NotificationChannel;
import com.uptimesentinel.core.util.JsonUtils;
import com.uptimesentinel.service.notify.DispatchSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.ToLongFunction;
import java.util.logging.Logger;

/**
 * Reads the JSON files of a config directory. {@code monitors.json} is required;
 * {@code service.json}, {@code channels.json} and {@code bindings.json} may be absent.
 * Malformed files fail with {@link IllegalStateException} naming the file.
 */
public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    public static ServiceSettings loadSettings(Path configDir) {
        Path path = configDir.resolve("service.json");
        if (!Files.exists(path)) {
            LOGGER.info("No " + path + ", using default service settings");
            return ServiceSettings.defaults();
        }
        JsonNode root = read(path, new TypeReference<>() {
        });
        try {
            return settingsFrom(root, ServiceSettings.defaults());
        } catch (RuntimeException e) {
            throw new IllegalStateException("Invalid settings in " + path + ": " + e.getMessage(), e);
        }
    }

    public static List<Monitor> loadMonitors(Path configDir, MonitorDefaults defaults) {
        Path path = configDir.resolve("monitors.json");
        List<Monitor> monitors = read(path, new TypeReference<List<Monitor>>() {
        });
        requireUniqueIds(path, monitors, Monitor::id);
        return monitors.stream().map(monitor -> monitor.withDefaults(defaults)).toList();
    }

    public static List<NotificationChannel> loadChannels(Path configDir) {
        Path path = configDir.resolve("channels.json");
        if (!Files.exists(path)) {
            return List.of();
        }
        List<NotificationChannel> channels = read(path, new TypeReference<>() {
        });
        requireUniqueIds(path, channels, NotificationChannel::id);
        return channels;
    }

    public static List<ChannelBinding> loadBindings(Path configDir) {
        Path path = configDir.resolve("bindings.json");
        if (!Files.exists(path)) {
            return List.of();
        }
        return read(path, new TypeReference<>() {
        });
    }

    /**
     * Applies {@code PORT}, {@code MONITOR_INTERVAL}, {@code MONITOR_TIMEOUT},
     * {@code MONITOR_RETRIES}, {@code SLOW_RESPONSE_THRESHOLD_MS} and {@code CHECK_LOG}. Values
     * that do not parse are reported through {@code warn} and ignored.
     */
    public static ServiceSettings applyEnvironment(
            ServiceSettings settings,
            Map<String, String> env,
            Consumer<String> warn
    ) {
        ServiceSettings result = settings;
        Integer port = intFromEnv(env, "PORT", warn);
        if (port != null) {
            if (port >= 0 && port <= 65_535) {
                result = result.withPort(port);
            } else {
                warn.accept("Ignoring PORT=" + port + ", out of range");
            }
        }

        Integer threshold = intFromEnv(env, "SLOW_RESPONSE_THRESHOLD_MS", warn);
        if (threshold != null) {
            result = result.withSlowResponseThresholdMillis(Math.max(0, threshold));
        }

        MonitorDefaults defaults = result.monitorDefaults();
        Integer interval = intFromEnv(env, "MONITOR_INTERVAL", warn);
        Integer timeout = intFromEnv(env, "MONITOR_TIMEOUT", warn);
        Integer retries = intFromEnv(env, "MONITOR_RETRIES", warn);
        if (interval != null || timeout != null || retries != null) {
            try {
                result = result.withMonitorDefaults(new MonitorDefaults(
                        interval != null ? interval : defaults.intervalSeconds(),
                        timeout != null ? timeout : defaults.timeoutSeconds(),
                        retries != null ? retries : defaults.maxRetries()
                ));
            } catch (IllegalArgumentException e) {
                warn.accept("Ignoring monitor default overrides: " + e.getMessage());
            }
        }

        String checkLog = env.get("CHECK_LOG");
        if (checkLog != null && !checkLog.isBlank()) {
            result = result.withCheckLog(Path.of(checkLog.trim()));
        }
        return result;
    }

    static ServiceSettings settingsFrom(JsonNode root, ServiceSettings fallback) {
        JsonNode defaultsNode = root.path("monitorDefaults");
        MonitorDefaults defaults = new MonitorDefaults(
                defaultsNode.path("intervalSeconds").asInt(fallback.monitorDefaults().intervalSeconds()),
                defaultsNode.path("timeoutSeconds").asInt(fallback.monitorDefaults().timeoutSeconds()),
                defaultsNode.path("maxRetries").asInt(fallback.monitorDefaults().maxRetries())
        );
        JsonNode notifications = root.path("notifications");
        DispatchSettings dispatch = new DispatchSettings(
                notifications.path("workers").asInt(fallback.dispatch().workers()),
                notifications.path("queueCapacity").asInt(fallback.dispatch().queueCapacity()),
                Duration.ofSeconds(notifications.path("sendTimeoutSeconds")
                        .asLong(fallback.dispatch().sendTimeout().toSeconds()))
        );
        return new ServiceSettings(
                root.path("host").asText(fallback.host()),
                root.path("port").asInt(fallback.port()),
                root.path("slowResponseThresholdMs").asLong(fallback.slowResponseThresholdMillis()),
                defaults,
                dispatch,
                Duration.ofSeconds(root.path("httpConnectTimeoutSeconds")
                        .asLong(fallback.httpConnectTimeout().toSeconds())),
                root.hasNonNull("timeZone") ? ZoneId.of(root.get("timeZone").asText()) : fallback.zone(),
                root.hasNonNull("checkLog") ? Path.of(root.get("checkLog").asText()) : fallback.checkLog()
        );
    }

    private static Integer intFromEnv(Map<String, String> env, String key, Consumer<String> warn) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            warn.accept("Ignoring " + key + "=" + raw + ", not a number");
            return null;
        }
    }

    private static <T> void requireUniqueIds(Path path, List<T> entries, ToLongFunction<T> id) {
        Set<Long> seen = new HashSet<>();
        for (T entry : entries) {
            if (!seen.add(id.applyAsLong(entry))) {
                throw new IllegalStateException("Duplicate id " + id.applyAsLong(entry) + " in " + path);
            }
        }
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
