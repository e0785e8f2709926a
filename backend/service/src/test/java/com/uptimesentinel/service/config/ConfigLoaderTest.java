package com.uptimesentinel.service.config;

import com.uptimesentinel.core.model.ChannelBinding;
import com.uptimesentinel.core.model.Monitor;
import com.uptimesentinel.core.model.MonitorDefaults;
import com.uptimesentinel.core.model.NotificationChannel;
import com.uptimesentinel.core.model.NotificationEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @TempDir
    Path configDir;

    @Test
    void missingServiceFileYieldsDefaults() {
        ServiceSettings settings = ConfigLoader.loadSettings(configDir);

        assertEquals(ServiceSettings.defaults(), settings);
        assertEquals(5_000, settings.slowResponseThresholdMillis());
        assertEquals(MonitorDefaults.STANDARD, settings.monitorDefaults());
    }

    @Test
    void serviceFileOverridesOnlyTheGivenFields() throws Exception {
        Files.writeString(configDir.resolve("service.json"), """
                {
                  "port": 9090,
                  "slowResponseThresholdMs": 0,
                  "monitorDefaults": { "intervalSeconds": 120 },
                  "notifications": { "workers": 2, "sendTimeoutSeconds": 3 },
                  "timeZone": "Europe/Berlin"
                }
                """);

        ServiceSettings settings = ConfigLoader.loadSettings(configDir);

        assertEquals(9090, settings.port());
        assertEquals(0, settings.slowResponseThresholdMillis());
        assertEquals(new MonitorDefaults(120, 30, 3), settings.monitorDefaults());
        assertEquals(2, settings.dispatch().workers());
        assertEquals(256, settings.dispatch().queueCapacity());
        assertEquals(Duration.ofSeconds(3), settings.dispatch().sendTimeout());
        assertEquals(ZoneId.of("Europe/Berlin"), settings.zone());
    }

    @Test
    void invalidServiceFileNamesTheFile() throws Exception {
        Files.writeString(configDir.resolve("service.json"), "{ \"notifications\": { \"workers\": 0 } }");

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadSettings(configDir));

        assertTrue(error.getMessage().contains("service.json"), error.getMessage());
    }

    @Test
    void monitorsFillZeroValuesFromDefaultsAndAcceptLegacyNames() throws Exception {
        Files.writeString(configDir.resolve("monitors.json"), """
                [
                  {"id": 1, "name": "web", "url": "https://example.com", "type": "https", "interval": 15, "active": true},
                  {"id": 2, "name": "db", "target": "db:5432", "kind": "tcp", "timeoutSeconds": 4, "maxRetries": 1, "active": true}
                ]
                """);

        List<Monitor> monitors = ConfigLoader.loadMonitors(configDir, new MonitorDefaults(60, 30, 3));

        assertEquals(new Monitor(1, "web", "https://example.com", "https", 15, 30, 3, true), monitors.get(0));
        assertEquals(new Monitor(2, "db", "db:5432", "tcp", 60, 4, 1, true), monitors.get(1));
    }

    @Test
    void missingMonitorsFileFailsFast() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> ConfigLoader.loadMonitors(configDir, MonitorDefaults.STANDARD));

        assertTrue(error.getMessage().contains("monitors.json"));
    }

    @Test
    void duplicateMonitorIdsAreRejected() throws Exception {
        Files.writeString(configDir.resolve("monitors.json"), """
                [
                  {"id": 1, "name": "a", "target": "https://a.example.com", "active": true},
                  {"id": 1, "name": "b", "target": "https://b.example.com", "active": true}
                ]
                """);

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> ConfigLoader.loadMonitors(configDir, MonitorDefaults.STANDARD));

        assertTrue(error.getMessage().contains("Duplicate id 1"));
    }

    @Test
    void channelsAndBindingsAreOptionalAndParseEventAliases() throws Exception {
        assertTrue(ConfigLoader.loadChannels(configDir).isEmpty());
        assertTrue(ConfigLoader.loadBindings(configDir).isEmpty());

        Files.writeString(configDir.resolve("channels.json"), """
                [{"id": 1, "name": "ops", "url": "logger://", "events": ["down", "recovery"], "enabled": true}]
                """);
        Files.writeString(configDir.resolve("bindings.json"), """
                [{"monitorId": 1, "channelId": 1, "events": ["slow"]}, {"monitorId": 2, "channelId": 1}]
                """);

        NotificationChannel channel = ConfigLoader.loadChannels(configDir).get(0);
        List<ChannelBinding> bindings = ConfigLoader.loadBindings(configDir);

        assertEquals(Set.of(NotificationEvent.DOWN, NotificationEvent.RECOVERY), channel.events());
        assertEquals(Set.of(NotificationEvent.SLOW), bindings.get(0).eventOverride().orElseThrow());
        assertTrue(bindings.get(1).eventOverride().isEmpty());
    }

    @Test
    void unknownEventNameFailsFast() throws Exception {
        Files.writeString(configDir.resolve("channels.json"), """
                [{"id": 1, "name": "ops", "url": "logger://", "events": ["exploded"], "enabled": true}]
                """);

        assertThrows(IllegalStateException.class, () -> ConfigLoader.loadChannels(configDir));
    }

    @Test
    void environmentOverridesSettingsAndWarnsOnGarbage() {
        List<String> warnings = new ArrayList<>();

        ServiceSettings settings = ConfigLoader.applyEnvironment(ServiceSettings.defaults(), Map.of(
                "PORT", "9191",
                "MONITOR_INTERVAL", "45",
                "MONITOR_RETRIES", "five",
                "SLOW_RESPONSE_THRESHOLD_MS", "2500",
                "CHECK_LOG", "/var/lib/uptime/checks.jsonl"
        ), warnings::add);

        assertEquals(9191, settings.port());
        assertEquals(new MonitorDefaults(45, 30, 3), settings.monitorDefaults());
        assertEquals(2_500, settings.slowResponseThresholdMillis());
        assertEquals(Path.of("/var/lib/uptime/checks.jsonl"), settings.checkLog());
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("MONITOR_RETRIES"));
    }

    @Test
    void invalidMonitorDefaultOverrideIsIgnored() {
        List<String> warnings = new ArrayList<>();

        ServiceSettings settings = ConfigLoader.applyEnvironment(
                ServiceSettings.defaults(),
                Map.of("MONITOR_TIMEOUT", "0", "PORT", "70000"),
                warnings::add
        );

        assertEquals(MonitorDefaults.STANDARD, settings.monitorDefaults());
        assertEquals(ServiceSettings.DEFAULT_PORT, settings.port());
        assertEquals(2, warnings.size());
    }
}
