package com.uptimesentinel.service.store;

import com.uptimesentinel.core.bus.EventBus;
import com.uptimesentinel.core.events.CheckRecorded;
import com.uptimesentinel.core.events.DeliveryFailed;
import com.uptimesentinel.core.events.Event;
import com.uptimesentinel.core.events.MonitorStatusChanged;
import com.uptimesentinel.core.events.TickFailed;
import com.uptimesentinel.core.util.JsonUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Envelope used for live-update payloads: {@code {"type", "timestamp", "event"}}.
 */
public final class EventCodec {
    private static final List<Class<? extends Event>> LIVE_TYPES = List.of(
            CheckRecorded.class,
            MonitorStatusChanged.class,
            DeliveryFailed.class,
            TickFailed.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> liveEventTypes() {
        return LIVE_TYPES;
    }

    public static String toSseData(Event event) {
        return JsonUtils.toJson(new Envelope(event.type(), event.timestamp(), event));
    }

    /**
     * Subscribes {@code consumer} to every live event type and returns one handle that removes
     * all of the subscriptions.
     */
    public static Runnable subscribeLive(EventBus bus, Consumer<Event> consumer) {
        List<Runnable> handles = new ArrayList<>();
        for (Class<? extends Event> type : LIVE_TYPES) {
            handles.add(bus.subscribe(type, consumer::accept));
        }
        return () -> handles.forEach(Runnable::run);
    }

    private record Envelope(String type, Instant timestamp, Event event) {
    }
}
