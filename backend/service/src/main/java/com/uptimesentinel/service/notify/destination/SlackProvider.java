package com.uptimesentinel.service.notify.destination;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * {@code slack://[botname@]tokenA/tokenB/tokenC[?channel=name]}, the three parts of an
 * incoming webhook path.
 */
public class SlackProvider implements DestinationProvider {
    static final URI DEFAULT_API_BASE = URI.create("https://hooks.slack.com/services/");

    private static final Pattern TOKEN_PART = Pattern.compile("[A-Za-z0-9_-]+");
    private static final ServiceInfo INFO = new ServiceInfo(
            "Slack",
            "slack",
            "slack://[botname@]tokenA/tokenB/tokenC",
            "slack://monitor@T00000000/B00000000/XXXXXXXXXXXXXXXXXXXXXXXX",
            "Slack incoming webhooks"
    );

    private final HttpDelivery delivery;
    private final URI apiBase;

    public SlackProvider(HttpClient httpClient, Duration timeout) {
        this(httpClient, timeout, DEFAULT_API_BASE);
    }

    SlackProvider(HttpClient httpClient, Duration timeout, URI apiBase) {
        this.delivery = new HttpDelivery(httpClient, timeout);
        this.apiBase = apiBase;
    }

    @Override
    public ServiceInfo info() {
        return INFO;
    }

    @Override
    public DestinationSender create(URI destination) {
        List<String> tokens = new ArrayList<>();
        String first = DestinationUrls.host(destination);
        if (first != null && !first.isBlank()) {
            tokens.add(first);
        }
        tokens.addAll(DestinationUrls.pathSegments(destination));
        if (tokens.size() != 3) {
            throw new InvalidDestinationException("Slack destination requires three webhook token parts");
        }
        for (String token : tokens) {
            if (!TOKEN_PART.matcher(token).matches()) {
                throw new InvalidDestinationException("Slack webhook token contains invalid characters");
            }
        }
        URI endpoint = DestinationUrls.under(apiBase, String.join("/", tokens));
        String botName = DestinationUrls.userInfo(destination);
        String channel = DestinationUrls.query(destination).get("channel");

        return message -> {
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put("text", message);
            if (botName != null && !botName.isBlank()) {
                payload.put("username", botName);
            }
            if (channel != null && !channel.isBlank()) {
                payload.put("channel", channel);
            }
            delivery.postJson("Slack", endpoint, payload, Map.of());
        };
    }
}
