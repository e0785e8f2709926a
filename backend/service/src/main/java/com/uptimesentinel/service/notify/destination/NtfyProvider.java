package com.uptimesentinel.service.notify.destination;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code ntfy://[user:pass@]host[:port]/topic[?disabletls=yes&priority=n&tags=a,b]}.
 */
public class NtfyProvider implements DestinationProvider {
    private static final ServiceInfo INFO = new ServiceInfo(
            "Ntfy",
            "ntfy",
            "ntfy://[user:pass@]host/topic",
            "ntfy://ntfy.sh/mytopic",
            "Ntfy pub/sub notifications"
    );

    private final HttpDelivery delivery;

    public NtfyProvider(HttpClient httpClient, Duration timeout) {
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
        if (segments.size() != 1) {
            throw new InvalidDestinationException("Ntfy destination requires exactly one topic");
        }
        URI endpoint = URI.create(DestinationUrls.webScheme(query) + "://" + authority + "/" + segments.get(0));

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Title", GenericWebhookProvider.TITLE);
        if (query.containsKey("priority")) {
            headers.put("Priority", query.get("priority"));
        }
        if (query.containsKey("tags")) {
            headers.put("Tags", query.get("tags"));
        }
        String userInfo = destination.getUserInfo();
        if (userInfo != null && !userInfo.isBlank()) {
            String encoded = Base64.getEncoder().encodeToString(userInfo.getBytes(StandardCharsets.UTF_8));
            headers.put("Authorization", "Basic " + encoded);
        }
        Map<String, String> fixedHeaders = Map.copyOf(headers);

        return message -> delivery.post("ntfy", endpoint, "text/plain; charset=utf-8", message, fixedHeaders);
    }
}
