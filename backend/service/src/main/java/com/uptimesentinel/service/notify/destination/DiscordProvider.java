package com.uptimesentinel.service.notify.destination;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code discord://token@webhookid[?username=name]}.
 */
public class DiscordProvider implements DestinationProvider {
    static final URI DEFAULT_API_BASE = URI.create("https://discord.com/api/webhooks/");

    private static final ServiceInfo INFO = new ServiceInfo(
            "Discord",
            "discord",
            "discord://token@id",
            "discord://token@webhookid",
            "Discord webhook notifications"
    );

    private final HttpDelivery delivery;
    private final URI apiBase;

    public DiscordProvider(HttpClient httpClient, Duration timeout) {
        this(httpClient, timeout, DEFAULT_API_BASE);
    }

    DiscordProvider(HttpClient httpClient, Duration timeout, URI apiBase) {
        this.delivery = new HttpDelivery(httpClient, timeout);
        this.apiBase = apiBase;
    }

    @Override
    public ServiceInfo info() {
        return INFO;
    }

    @Override
    public DestinationSender create(URI destination) {
        String token = DestinationUrls.userInfo(destination);
        String webhookId = DestinationUrls.host(destination);
        if (token == null || token.isBlank()) {
            throw new InvalidDestinationException("Discord destination requires a webhook token");
        }
        if (webhookId == null || webhookId.isBlank()) {
            throw new InvalidDestinationException("Discord destination requires a webhook id");
        }
        URI endpoint = DestinationUrls.under(apiBase, webhookId + "/" + token);
        String username = DestinationUrls.query(destination).get("username");

        return message -> {
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put("content", message);
            if (username != null && !username.isBlank()) {
                payload.put("username", username);
            }
            delivery.postJson("Discord", endpoint, payload, Map.of());
        };
    }
}
