package com.uptimesentinel.service.notify.destination;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code teams://group@tenant/altId/groupOwner?host=organization.webhook.office.com}, rebuilt
 * into the Office 365 connector URL {@code https://<host>/webhookb2/<group>@<tenant>/IncomingWebhook/<altId>/<groupOwner>}.
 */
public class TeamsProvider implements DestinationProvider {
    private static final ServiceInfo INFO = new ServiceInfo(
            "Teams",
            "teams",
            "teams://group@tenant/altId/groupOwner?host=host",
            "teams://group@tenant/altId/groupOwner?host=organization.webhook.office.com",
            "Microsoft Teams webhook"
    );

    private final HttpDelivery delivery;

    public TeamsProvider(HttpClient httpClient, Duration timeout) {
        this.delivery = new HttpDelivery(httpClient, timeout);
    }

    @Override
    public ServiceInfo info() {
        return INFO;
    }

    @Override
    public DestinationSender create(URI destination) {
        Map<String, String> query = DestinationUrls.query(destination);
        String group = DestinationUrls.userInfo(destination);
        String tenant = DestinationUrls.host(destination);
        List<String> segments = DestinationUrls.pathSegments(destination);
        if (group == null || group.isBlank() || tenant == null || tenant.isBlank() || segments.size() != 2) {
            throw new InvalidDestinationException("Teams destination requires group@tenant/altId/groupOwner");
        }
        String host = query.get("host");
        if (host == null || host.isBlank()) {
            throw new InvalidDestinationException("Teams destination requires the webhook host parameter");
        }
        URI endpoint = URI.create(DestinationUrls.webScheme(query) + "://" + host + "/webhookb2/"
                + group + "@" + tenant + "/IncomingWebhook/" + segments.get(0) + "/" + segments.get(1));
        String themeColor = query.get("color");

        return message -> {
            Map<String, String> card = new LinkedHashMap<>();
            card.put("@type", "MessageCard");
            card.put("@context", "http://schema.org/extensions");
            card.put("summary", GenericWebhookProvider.TITLE);
            card.put("title", GenericWebhookProvider.TITLE);
            card.put("text", message.replace("\n", "<br>"));
            if (themeColor != null && !themeColor.isBlank()) {
                card.put("themeColor", themeColor);
            }
            delivery.postJson("Teams", endpoint, card, Map.of());
        };
    }
}
