package com.uptimesentinel.probes.http;

import com.uptimesentinel.probes.api.Probe;
import com.uptimesentinel.probes.api.ProbeOutcome;

import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Issues one GET per probe. Any status in {@code [200, 400)} counts as up.
 */
public class HttpProbe implements Probe {
    static final String USER_AGENT = "uptime-sentinel/0.1";

    private final HttpClient httpClient;

    public HttpProbe(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public ProbeOutcome probe(String target, Duration timeout) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(target.trim()))
                    .GET()
                    .timeout(timeout)
                    .header("User-Agent", USER_AGENT)
                    .build();
        } catch (IllegalArgumentException e) {
            return ProbeOutcome.down("Invalid URL " + target + ": " + e.getMessage());
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        return ProbeOutcome.down(describeFailure(target, error));
                    }
                    int code = response.statusCode();
                    if (code >= 200 && code < 400) {
                        return ProbeOutcome.up(code, "OK");
                    }
                    return ProbeOutcome.down(code, "HTTP " + code);
                })
                .join();
    }

    static String describeFailure(String url, Throwable error) {
        Throwable root = rootCause(error);
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String lowered = rootText.toLowerCase(Locale.ROOT);
        if (root instanceof UnknownHostException
                || lowered.contains("unknown host")
                || lowered.contains("name or service")
                || lowered.contains("not known")
                || lowered.contains("nodename")) {
            return "DNS/unknown host while fetching " + url + ": " + rootText;
        }
        if (root instanceof TimeoutException || root instanceof HttpTimeoutException || lowered.contains("timed out")) {
            return "Request timed out while fetching " + url;
        }
        return "Fetch failure for " + url + ": " + rootText;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
