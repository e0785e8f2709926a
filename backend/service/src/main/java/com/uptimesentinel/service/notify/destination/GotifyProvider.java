package com.uptimesentinel.service.notify.destination;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code gotify://host[:port][/path]/token[?disabletls=yes&priority=n]}. The last path segment
 * is the application token.
 */
public class GotifyProvider implements DestinationProvider {
    static final int DEFAULT_PRIORITY = 5;

    private static final ServiceInfo INFO = new ServiceInfo(
            "Gotify",
            "gotify",
            "gotify://host[/path]/token",
            "gotify://gotify.example.com/tokenvalue",
            "Gotify self-hosted notifications"
    );

    private final HttpDelivery delivery;

    public GotifyProvider(HttpClient httpClient, Duration timeout) {
        this.delivery = new HttpDelivery(httpClient, timeout);
    }

    @Override
    public ServiceInfo info() {
        return INFO;
    }

    @Override
    public DestinationSender create(URI destination) {
        Map<String, String> query = DestinationUrls.query(destination);
        String authority = DestinationUrls.hostAndPort(destination, INFO.name());
        List<String> segments = DestinationUrls.pathSegments(destination);
        if (segments.isEmpty()) {
            throw new InvalidDestinationException("Gotify destination requires an application token");
        }
        String token = segments.get(segments.size() - 1);
        StringBuilder path = new StringBuilder();
        for (String segment : segments.subList(0, segments.size() - 1)) {
            path.append('/').append(segment);
        }
        URI endpoint = URI.create(DestinationUrls.webScheme(query) + "://" + authority + path + "/message");
        int priority = priority(query.get("priority"));

        return message -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("title", GenericWebhookProvider.TITLE);
            payload.put("message", message);
            payload.put("priority", priority);
            delivery.postJson("Gotify", endpoint, payload, Map.of("X-Gotify-Key", token));
        };
    }

    private static int priority(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_PRIORITY;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidDestinationException("Gotify priority must be a number", e);
        }
    }
}
