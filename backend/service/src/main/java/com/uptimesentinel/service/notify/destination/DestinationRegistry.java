package com.uptimesentinel.service.notify.destination;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps destination URL schemes to providers. Error messages never echo the URL, which usually
 * carries credentials.
 */
public final class DestinationRegistry {
    private static final Pattern SCHEME = Pattern.compile("[A-Za-z][A-Za-z0-9+.-]*");

    private final Map<String, DestinationProvider> providers;
    private final List<String> order;

    private DestinationRegistry(Map<String, DestinationProvider> providers) {
        this.providers = Map.copyOf(providers);
        this.order = List.copyOf(providers.keySet());
    }

    public static DestinationRegistry defaults(HttpClient httpClient, Duration sendTimeout) {
        return builder()
                .register(new DiscordProvider(httpClient, sendTimeout))
                .register(new SlackProvider(httpClient, sendTimeout))
                .register(new TelegramProvider(httpClient, sendTimeout))
                .register(new SmtpProvider(sendTimeout))
                .register(new PushoverProvider(httpClient, sendTimeout))
                .register(new GotifyProvider(httpClient, sendTimeout))
                .register(new NtfyProvider(httpClient, sendTimeout))
                .register(new MatrixProvider(httpClient, sendTimeout))
                .register(new MattermostProvider(httpClient, sendTimeout))
                .register(new OpsgenieProvider(httpClient, sendTimeout))
                .register(new PushbulletProvider(httpClient, sendTimeout))
                .register(new GenericWebhookProvider(httpClient, sendTimeout))
                .register(new TeamsProvider(httpClient, sendTimeout))
                .register(new ZulipProvider(httpClient, sendTimeout))
                .register(new RocketChatProvider(httpClient, sendTimeout))
                .register(new LoggerProvider())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds and discards a sender. Nothing is sent.
     *
     * @throws InvalidDestinationException when the URL is malformed or names no known service
     */
    public void validate(String url) {
        createSender(url);
    }

    public DestinationSender createSender(String url) {
        URI destination = parse(url);
        DestinationProvider provider = providers.get(destination.getScheme().toLowerCase(Locale.ROOT));
        if (provider == null) {
            throw new InvalidDestinationException("unsupported destination service: " + destination.getScheme());
        }
        return provider.create(destination);
    }

    public boolean supports(String scheme) {
        return scheme != null && providers.containsKey(scheme.toLowerCase(Locale.ROOT));
    }

    public List<ServiceInfo> supportedServices() {
        List<ServiceInfo> services = new ArrayList<>();
        for (String scheme : order) {
            services.add(providers.get(scheme).info());
        }
        return services;
    }

    static URI parse(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidDestinationException("destination URL is required");
        }
        String trimmed = url.trim();
        int separator = trimmed.indexOf("://");
        if (separator <= 0 || !SCHEME.matcher(trimmed.substring(0, separator)).matches()) {
            throw new InvalidDestinationException("destination URL must start with <service>://");
        }
        // "logger://" has no authority, which java.net.URI rejects
        if (separator + 3 == trimmed.length()) {
            trimmed = trimmed + "/";
        }
        try {
            return new URI(trimmed);
        } catch (URISyntaxException e) {
            throw new InvalidDestinationException("malformed destination URL for service " + trimmed.substring(0, separator));
        }
    }

    public static final class Builder {
        private final Map<String, DestinationProvider> providers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(DestinationProvider provider) {
            String scheme = provider.scheme();
            if (scheme == null || !SCHEME.matcher(scheme).matches()) {
                throw new IllegalArgumentException("Provider scheme is invalid: " + scheme);
            }
            providers.put(scheme.toLowerCase(Locale.ROOT), provider);
            return this;
        }

        public DestinationRegistry build() {
            return new DestinationRegistry(providers);
        }
    }
}
