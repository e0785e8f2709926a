package com.uptimesentinel.service.notify;

import com.uptimesentinel.core.model.NotificationEvent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one fan-out. A channel that failed keeps its failure reason; the others are
 * delivered.
 */
public record DispatchReport(long monitorId, NotificationEvent event, List<Delivery> deliveries) {
    public DispatchReport {
        deliveries = List.copyOf(deliveries);
    }

    public static DispatchReport empty(long monitorId, NotificationEvent event) {
        return new DispatchReport(monitorId, event, List.of());
    }

    public List<String> delivered() {
        return deliveries.stream().filter(Delivery::succeeded).map(Delivery::channelName).toList();
    }

    public Map<String, String> failures() {
        Map<String, String> failures = new LinkedHashMap<>();
        for (Delivery delivery : deliveries) {
            if (!delivery.succeeded()) {
                failures.put(delivery.channelName(), delivery.error());
            }
        }
        return failures;
    }

    public boolean allDelivered() {
        return deliveries.stream().allMatch(Delivery::succeeded);
    }

    public record Delivery(String channelName, String error) {
        public static Delivery delivered(String channelName) {
            return new Delivery(channelName, null);
        }

        public static Delivery failed(String channelName, String error) {
            return new Delivery(channelName, error);
        }

        public boolean succeeded() {
            return error == null;
        }
    }
}
