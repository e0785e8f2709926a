package com.uptimesentinel.core.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.uptimesentinel.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreModelsTest {
    @Test
    void notificationEventAcceptsWireIdsAndShortAliases() {
        assertEquals(NotificationEvent.UP, NotificationEvent.fromId("monitor_up"));
        assertEquals(NotificationEvent.UP, NotificationEvent.fromId("up"));
        assertEquals(NotificationEvent.DOWN, NotificationEvent.fromId("Monitor_Down"));
        assertEquals(NotificationEvent.SLOW, NotificationEvent.fromId("slow"));
        assertEquals(NotificationEvent.SLOW, NotificationEvent.fromId("response_slow"));
        assertEquals(NotificationEvent.RECOVERY, NotificationEvent.fromId("recovery"));
        assertThrows(IllegalArgumentException.class, () -> NotificationEvent.fromId("ssl_expiring"));
    }

    @Test
    void channelWithoutEventsUsesDefaultSubscription() {
        NotificationChannel channel = new NotificationChannel(1, "ops", "logger://", Set.of(), true);

        assertEquals(NotificationEvent.DEFAULT_SUBSCRIPTION, channel.subscription());
        assertFalse(channel.subscription().contains(NotificationEvent.SLOW));
    }

    @Test
    void bindingOverrideReplacesChannelSubscription() {
        NotificationChannel channel = new NotificationChannel(
                1, "ops", "logger://", Set.of(NotificationEvent.DOWN, NotificationEvent.RECOVERY), true);
        ChannelBinding binding = new ChannelBinding(7, 1, Set.of(NotificationEvent.SLOW));

        BoundChannel bound = BoundChannel.of(channel, binding);

        assertTrue(bound.subscribesTo(NotificationEvent.SLOW));
        assertFalse(bound.subscribesTo(NotificationEvent.DOWN));
    }

    @Test
    void emptyBindingOverrideFallsBackToChannel() {
        ChannelBinding binding = new ChannelBinding(7, 1, Set.of());

        assertEquals(Optional.empty(), binding.eventOverride());
    }

    @Test
    void monitorDefaultsFillUnsetValuesOnly() {
        Monitor monitor = new Monitor(3, "db", "db:5432", "tcp", 0, 10, 0, true)
                .withDefaults(MonitorDefaults.STANDARD);

        assertEquals(60, monitor.intervalSeconds());
        assertEquals(10, monitor.timeoutSeconds());
        assertEquals(3, monitor.maxRetries());
    }

    @Test
    void parsesStoredRowNamesAndEventLists() throws Exception {
        List<Monitor> monitors = JsonUtils.objectMapper().readValue("""
                [{"id":1,"name":"site","url":"https://example.com","type":"https","interval":30,
                  "timeout":5,"max_retries":2,"active":true}]
                """, new TypeReference<>() {
        });
        NotificationChannel channel = JsonUtils.objectMapper().readValue("""
                {"id":2,"name":"slack","url":"slack://a/b/c","events":["monitor_down","slow"],"enabled":true}
                """, NotificationChannel.class);

        Monitor monitor = monitors.get(0);
        assertEquals("https://example.com", monitor.target());
        assertEquals("https", monitor.kind());
        assertEquals(30, monitor.intervalSeconds());
        assertEquals(2, monitor.maxRetries());
        assertEquals(Set.of(NotificationEvent.DOWN, NotificationEvent.SLOW), channel.events());
    }

    @Test
    void blankKindDefaultsToHttp() {
        Monitor monitor = new Monitor(1, "a", "https://example.com", " ", 60, 30, 3, true);
        assertEquals("http", monitor.kind());
    }
}
