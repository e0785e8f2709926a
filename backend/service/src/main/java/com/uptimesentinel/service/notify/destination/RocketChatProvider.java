package com.uptimesentinel.service.notify.destination;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code rocketchat://[username@]host[:port]/tokenA/tokenB[/channel][?disabletls=yes]}. The two
 * token parts form the integration path under {@code /hooks}.
 */
public class RocketChatProvider implements DestinationProvider {
    private static final ServiceInfo INFO = new ServiceInfo(
            "Rocket.Chat",
            "rocketchat",
            "rocketchat://[user@]host/tokenA/tokenB[/channel]",
            "rocketchat://user@rocket.example.com/tokenA/tokenB/general",
            "Rocket.Chat notifications"
    );

    private final HttpDelivery delivery;

    public RocketChatProvider(HttpClient httpClient, Duration timeout) {
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
        if (segments.size() < 2 || segments.size() > 3) {
            throw new InvalidDestinationException("Rocket.Chat destination requires two token parts and an optional channel");
        }
        URI endpoint = URI.create(DestinationUrls.webScheme(query) + "://" + authority
                + "/hooks/" + segments.get(0) + "/" + segments.get(1));
        String channel = segments.size() == 3 ? channel(segments.get(2)) : null;
        String username = destination.getUserInfo();

        return message -> {
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put("text", message);
            if (username != null && !username.isBlank()) {
                payload.put("username", username);
            }
            if (channel != null) {
                payload.put("channel", channel);
            }
            delivery.postJson("Rocket.Chat", endpoint, payload, Map.of());
        };
    }

    // a bare name is a channel, "@name" a direct message
    private static String channel(String raw) {
        return raw.startsWith("@") || raw.startsWith("#") ? raw : "#" + raw;
    }
}
