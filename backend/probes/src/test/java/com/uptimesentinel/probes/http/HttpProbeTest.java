package com.uptimesentinel.probes.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import com.uptimesentinel.core.model.CheckStatus;
import com.uptimesentinel.probes.api.ProbeOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpProbeTest {
    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void successfulResponseIsUp() throws Exception {
        startServer(exchange -> writeResponse(exchange, 200, "ok"));

        ProbeOutcome outcome = probe().probe(url("/health"), Duration.ofSeconds(2));

        assertEquals(CheckStatus.UP, outcome.status());
        assertEquals(200, outcome.statusCode());
        assertEquals("OK", outcome.message());
        assertTrue(outcome.measuredLatency().isEmpty());
    }

    @Test
    void serviceUnavailableIsDownWithCodeAndMessage() throws Exception {
        startServer(exchange -> writeResponse(exchange, 503, "maintenance"));

        ProbeOutcome outcome = probe().probe(url("/health"), Duration.ofSeconds(2));

        assertEquals(CheckStatus.DOWN, outcome.status());
        assertEquals(503, outcome.statusCode());
        assertEquals("HTTP 503", outcome.message());
    }

    @Test
    void redirectWithoutFollowingIsStillUp() throws Exception {
        startServer(exchange -> {
            exchange.getResponseHeaders().set("Location", "/elsewhere");
            writeResponse(exchange, 302, "");
        });
        HttpProbe probe = new HttpProbe(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(1))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());

        ProbeOutcome outcome = probe.probe(url("/old"), Duration.ofSeconds(2));

        assertEquals(CheckStatus.UP, outcome.status());
        assertEquals(302, outcome.statusCode());
    }

    @Test
    void notFoundIsDown() throws Exception {
        startServer(exchange -> writeResponse(exchange, 404, "missing"));

        ProbeOutcome outcome = probe().probe(url("/missing"), Duration.ofSeconds(2));

        assertEquals(CheckStatus.DOWN, outcome.status());
        assertEquals("HTTP 404", outcome.message());
    }

    @Test
    void slowServerTimesOutAsDown() throws Exception {
        startServer(exchange -> {
            try {
                Thread.sleep(1_500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            writeResponse(exchange, 200, "late");
        });

        ProbeOutcome outcome = probe().probe(url("/slow"), Duration.ofMillis(200));

        assertEquals(CheckStatus.DOWN, outcome.status());
        assertNull(outcome.statusCode());
        assertTrue(outcome.message().contains("timed out"), outcome.message());
    }

    @Test
    void refusedConnectionIsDownWithoutCode() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        ProbeOutcome outcome = probe().probe("http://127.0.0.1:" + closedPort + "/", Duration.ofSeconds(1));

        assertEquals(CheckStatus.DOWN, outcome.status());
        assertNull(outcome.statusCode());
        assertTrue(outcome.message().contains("127.0.0.1:" + closedPort), outcome.message());
    }

    @Test
    void malformedTargetIsDownNotAnException() {
        ProbeOutcome outcome = probe().probe("not a url", Duration.ofSeconds(1));

        assertEquals(CheckStatus.DOWN, outcome.status());
        assertTrue(outcome.message().startsWith("Invalid URL"), outcome.message());
    }

    @Test
    void eachProbeIssuesExactlyOneRequest() throws Exception {
        AtomicInteger hits = new AtomicInteger();
        startServer(exchange -> {
            hits.incrementAndGet();
            writeResponse(exchange, 500, "err");
        });

        probe().probe(url("/flaky"), Duration.ofSeconds(2));

        assertEquals(1, hits.get());
    }

    private HttpProbe probe() {
        return new HttpProbe(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build());
    }

    private String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    private void startServer(HttpHandler handler) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", handler);
        server.start();
    }

    private static void writeResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }
}
