package com.uptimesentinel.service.notify.destination;

import com.uptimesentinel.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Blocking request shared by the webhook style providers. Any status of 400 or above is a
 * delivery failure.
 */
final class HttpDelivery {
    static final String USER_AGENT = "uptime-sentinel/0.1";

    private final HttpClient httpClient;
    private final Duration timeout;

    HttpDelivery(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    void postJson(String service, URI endpoint, Object payload, Map<String, String> headers) {
        post(service, endpoint, "application/json", JsonUtils.toJson(payload), headers);
    }

    void postForm(String service, URI endpoint, Map<String, String> fields, Map<String, String> headers) {
        post(service, endpoint, "application/x-www-form-urlencoded", DestinationUrls.form(fields), headers);
    }

    void post(String service, URI endpoint, String contentType, String body, Map<String, String> headers) {
        exchange(service, "POST", endpoint, contentType, body, headers);
    }

    /**
     * Sends one request and returns the response body. {@code body} may be null for methods
     * without one.
     */
    String exchange(
            String service,
            String method,
            URI endpoint,
            String contentType,
            String body,
            Map<String, String> headers
    ) {
        HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (contentType != null) {
            request.header("Content-Type", contentType);
        }
        headers.forEach(request::header);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new DeliveryException(service + " request timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new DeliveryException("failed to reach " + service + ": " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException(service + " delivery interrupted", e);
        }
        if (response.statusCode() >= 400) {
            throw new DeliveryException(service + " returned status: " + response.statusCode());
        }
        return response.body();
    }

    private static String describe(IOException error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
