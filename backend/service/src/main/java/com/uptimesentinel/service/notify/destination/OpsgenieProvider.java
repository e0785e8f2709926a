package com.uptimesentinel.service.notify.destination;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code opsgenie://host[:port]/apiKey[?disabletls=yes&priority=P1..P5]}. The first line of the
 * alert becomes the Opsgenie message, which the API caps at 130 characters; the full text goes
 * into the description.
 */
public class OpsgenieProvider implements DestinationProvider {
    static final int MAX_MESSAGE_LENGTH = 130;

    private static final ServiceInfo INFO = new ServiceInfo(
            "Opsgenie",
            "opsgenie",
            "opsgenie://host/apikey",
            "opsgenie://api.opsgenie.com/apikey",
            "Opsgenie alert notifications"
    );

    private final HttpDelivery delivery;

    public OpsgenieProvider(HttpClient httpClient, Duration timeout) {
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
            throw new InvalidDestinationException("Opsgenie destination requires exactly one API key");
        }
        String priority = query.get("priority");
        if (priority != null && !priority.matches("P[1-5]")) {
            throw new InvalidDestinationException("Opsgenie priority must be one of P1 to P5");
        }
        URI endpoint = URI.create(DestinationUrls.webScheme(query) + "://" + authority + "/v2/alerts");
        Map<String, String> headers = Map.of("Authorization", "GenieKey " + segments.get(0));

        return message -> {
            Map<String, String> alert = new LinkedHashMap<>();
            alert.put("message", summary(message));
            alert.put("description", message);
            alert.put("source", GenericWebhookProvider.TITLE);
            if (priority != null) {
                alert.put("priority", priority);
            }
            delivery.postJson("Opsgenie", endpoint, alert, headers);
        };
    }

    static String summary(String message) {
        int lineEnd = message.indexOf('\n');
        String firstLine = lineEnd < 0 ? message : message.substring(0, lineEnd);
        return firstLine.length() <= MAX_MESSAGE_LENGTH ? firstLine : firstLine.substring(0, MAX_MESSAGE_LENGTH);
    }
}
