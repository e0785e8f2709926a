package com.uptimesentinel.service.notify.destination;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * {@code generic://host[:port]/path[?disabletls=yes]}. Query parameters other than
 * {@code disabletls} are forwarded to the webhook.
 */
public class GenericWebhookProvider implements DestinationProvider {
    static final String TITLE = "Uptime Sentinel";

    private static final ServiceInfo INFO = new ServiceInfo(
            "Webhook (Generic)",
            "generic",
            "generic://host[:port]/path[?disabletls=yes]",
            "generic://example.com/webhook",
            "JSON POST of title and message to any HTTP endpoint"
    );

    private final HttpDelivery delivery;

    public GenericWebhookProvider(HttpClient httpClient, Duration timeout) {
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
        String path = destination.getRawPath() == null ? "" : destination.getRawPath();

        StringJoiner forwarded = new StringJoiner("&", "?", "").setEmptyValue("");
        query.forEach((key, value) -> {
            if (!key.equals(DestinationUrls.DISABLE_TLS)) {
                forwarded.add(key + "=" + value);
            }
        });
        URI endpoint;
        try {
            endpoint = URI.create(DestinationUrls.webScheme(query) + "://" + authority + path + forwarded);
        } catch (IllegalArgumentException e) {
            throw new InvalidDestinationException("invalid generic webhook address", e);
        }

        return message -> {
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put("title", TITLE);
            payload.put("message", message);
            delivery.postJson("generic webhook", endpoint, payload, Map.of());
        };
    }
}
