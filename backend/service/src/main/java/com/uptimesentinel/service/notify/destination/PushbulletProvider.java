package com.uptimesentinel.service.notify.destination;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code pushbullet://token[/target...]}. A target starting with {@code #} is a channel tag,
 * one containing {@code @} an email address, anything else a device id. Without targets the
 * push goes to all of the account's devices.
 */
public class PushbulletProvider implements DestinationProvider {
    static final URI DEFAULT_API_BASE = URI.create("https://api.pushbullet.com/v2/");

    private static final ServiceInfo INFO = new ServiceInfo(
            "Pushbullet",
            "pushbullet",
            "pushbullet://token[/device|#channel|email]",
            "pushbullet://o.abcdefghijklmnopqrstuvwxyz",
            "Pushbullet push notifications"
    );

    private final HttpDelivery delivery;
    private final URI apiBase;

    public PushbulletProvider(HttpClient httpClient, Duration timeout) {
        this(httpClient, timeout, DEFAULT_API_BASE);
    }

    PushbulletProvider(HttpClient httpClient, Duration timeout, URI apiBase) {
        this.delivery = new HttpDelivery(httpClient, timeout);
        this.apiBase = apiBase;
    }

    @Override
    public ServiceInfo info() {
        return INFO;
    }

    @Override
    public DestinationSender create(URI destination) {
        String token = DestinationUrls.host(destination);
        if (token == null || token.isBlank()) {
            throw new InvalidDestinationException("Pushbullet destination requires an access token");
        }
        List<String> targets = new ArrayList<>(DestinationUrls.pathSegments(destination));
        if (destination.getFragment() != null && !destination.getFragment().isBlank()) {
            targets.add("#" + destination.getFragment());
        }
        URI endpoint = DestinationUrls.under(apiBase, "pushes");
        Map<String, String> headers = Map.of("Access-Token", token);

        return message -> {
            if (targets.isEmpty()) {
                delivery.postJson("Pushbullet", endpoint, note(message, null), headers);
                return;
            }
            for (String target : targets) {
                delivery.postJson("Pushbullet", endpoint, note(message, target), headers);
            }
        };
    }

    private static Map<String, String> note(String message, String target) {
        Map<String, String> push = new LinkedHashMap<>();
        push.put("type", "note");
        push.put("title", GenericWebhookProvider.TITLE);
        push.put("body", message);
        if (target == null) {
            return push;
        }
        if (target.startsWith("#")) {
            push.put("channel_tag", target.substring(1));
        } else if (target.contains("@")) {
            push.put("email", target);
        } else {
            push.put("device_iden", target);
        }
        return push;
    }
}
