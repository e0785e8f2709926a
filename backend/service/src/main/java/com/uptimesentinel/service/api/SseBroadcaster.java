package com.uptimesentinel.service.api;

import com.uptimesentinel.core.bus.EventBus;
import com.uptimesentinel.core.events.Event;
import com.uptimesentinel.service.store.EventCodec;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Relays live monitor events to Server-Sent-Events clients. Each client holds one server thread
 * for the lifetime of its connection.
 */
public class SseBroadcaster implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(SseBroadcaster.class.getName());

    private final List<SseClient> clients = new CopyOnWriteArrayList<>();
    private final long keepAliveMillis;
    private final Runnable unsubscribe;

    public SseBroadcaster(EventBus eventBus) {
        this(eventBus, 15_000);
    }

    SseBroadcaster(EventBus eventBus, long keepAliveMillis) {
        this.keepAliveMillis = keepAliveMillis;
        this.unsubscribe = EventCodec.subscribeLive(eventBus, this::broadcast);
    }

    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }

        exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.getResponseHeaders().set("Connection", "keep-alive");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(200, 0);

        SseClient client = new SseClient(exchange, exchange.getResponseBody());
        clients.add(client);
        try {
            write(client, ": connected\n\n");
            while (!Thread.currentThread().isInterrupted() && clients.contains(client)) {
                Thread.sleep(keepAliveMillis);
                write(client, ": keepalive\n\n");
            }
        } catch (IOException disconnected) {
            LOGGER.fine("SSE client disconnected: " + disconnected.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            remove(client);
        }
    }

    public void broadcast(Event event) {
        String payload = "event: " + event.type() + "\n"
                + "data: " + EventCodec.toSseData(event) + "\n\n";
        for (SseClient client : clients) {
            try {
                write(client, payload);
            } catch (IOException e) {
                LOGGER.fine("Dropping SSE client after failed write: " + e.getMessage());
                remove(client);
            }
        }
    }

    public int clientCount() {
        return clients.size();
    }

    @Override
    public void close() {
        unsubscribe.run();
        for (SseClient client : clients) {
            remove(client);
        }
    }

    private void write(SseClient client, String data) throws IOException {
        synchronized (client) {
            client.out().write(data.getBytes(StandardCharsets.UTF_8));
            client.out().flush();
        }
    }

    private void remove(SseClient client) {
        if (clients.remove(client)) {
            client.close();
        }
    }

    private record SseClient(HttpExchange exchange, OutputStream out) {
        private void close() {
            try {
                out.close();
            } catch (IOException e) {
                LOGGER.log(Level.FINE, "Failed closing SSE stream", e);
            }
            exchange.close();
        }
    }
}
