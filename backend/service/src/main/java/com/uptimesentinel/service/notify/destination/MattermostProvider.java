package com.uptimesentinel.service.notify.destination;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code mattermost://[username@]host[:port][/path]/token[/channel][?disabletls=yes]}, posted to
 * the incoming webhook at {@code /hooks/<token>}.
 */
public class MattermostProvider implements DestinationProvider {
    private static final ServiceInfo INFO = new ServiceInfo(
            "Mattermost",
            "mattermost",
            "mattermost://[user@]host/token[/channel]",
            "mattermost://user@mattermost.example.com/token/town-square",
            "Mattermost webhook notifications"
    );

    private final HttpDelivery delivery;

    public MattermostProvider(HttpClient httpClient, Duration timeout) {
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
        if (segments.isEmpty() || segments.size() > 2) {
            throw new InvalidDestinationException("Mattermost destination requires a token and an optional channel");
        }
        URI endpoint = URI.create(DestinationUrls.webScheme(query) + "://" + authority + "/hooks/" + segments.get(0));
        String channel = segments.size() == 2 ? segments.get(1) : query.get("channel");
        String username = destination.getUserInfo();

        return message -> {
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put("text", message);
            if (username != null && !username.isBlank()) {
                payload.put("username", username);
            }
            if (channel != null && !channel.isBlank()) {
                payload.put("channel", channel);
            }
            delivery.postJson("Mattermost", endpoint, payload, Map.of());
        };
    }
}
