package com.uptimesentinel.service.api;

import com.uptimesentinel.core.model.Check;
import com.uptimesentinel.core.model.Monitor;
import com.uptimesentinel.core.util.JsonUtils;
import com.uptimesentinel.service.notify.destination.DestinationRegistry;
import com.uptimesentinel.service.runtime.MonitorScheduler;
import com.uptimesentinel.service.runtime.NamedThreadFactory;
import com.uptimesentinel.service.store.CatalogMonitorStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/**
 * Read-only JSON view of the running service plus the live event stream.
 */
public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final int DEFAULT_CHECK_LIMIT = 50;
    private static final int MAX_CHECK_LIMIT = 1_000;
    private static final int DEFAULT_STATS_HOURS = 24;

    private final String host;
    private final int port;
    private final CatalogMonitorStore store;
    private final MonitorScheduler scheduler;
    private final DestinationRegistry destinations;
    private final SseBroadcaster sseBroadcaster;
    private final Clock clock;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            String host,
            int port,
            CatalogMonitorStore store,
            MonitorScheduler scheduler,
            DestinationRegistry destinations,
            SseBroadcaster sseBroadcaster,
            Clock clock
    ) {
        this.host = host;
        this.port = port;
        this.store = store;
        this.scheduler = scheduler;
        this.destinations = destinations;
        this.sseBroadcaster = sseBroadcaster;
        this.clock = clock;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(host, port), 0);
            executor = Executors.newCachedThreadPool(new NamedThreadFactory("api"));
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/monitors", this::handleMonitors);
            server.createContext("/api/notifications/services", this::handleServices);
            server.createContext("/api/stream", sseBroadcaster::handle);
            server.start();
            LOGGER.info("API server listening on " + host + ":" + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("scheduledMonitors", scheduler.scheduledMonitorIds().size());
        writeJson(exchange, 200, body);
    }

    private void handleMonitors(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        String path = exchange.getRequestURI().getPath();
        String remainder = path.substring("/api/monitors".length());
        if (remainder.isEmpty() || remainder.equals("/")) {
            writeJson(exchange, 200, monitorViews());
            return;
        }

        String[] parts = remainder.substring(1).split("/");
        if (parts.length != 2 || !(parts[1].equals("checks") || parts[1].equals("stats"))) {
            writeJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        boolean stats = parts[1].equals("stats");
        long monitorId;
        int limit;
        int hours;
        try {
            monitorId = Long.parseLong(parts[0]);
            Map<String, String> query = queryParams(exchange.getRequestURI());
            limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : DEFAULT_CHECK_LIMIT;
            hours = query.containsKey("hours") ? Integer.parseInt(query.get("hours")) : DEFAULT_STATS_HOURS;
        } catch (NumberFormatException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        if (hours <= 0) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        if (store.monitor(monitorId).isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "monitor_not_found"));
            return;
        }
        if (stats) {
            // covers what the check history keeps in memory, at most MAX_CHECK_LIMIT checks
            List<Check> checks = store.recentChecks(monitorId, MAX_CHECK_LIMIT);
            writeJson(exchange, 200, MonitorStats.summarize(monitorId, checks,
                    clock.instant().minus(Duration.ofHours(hours))));
            return;
        }
        List<Check> checks = store.recentChecks(monitorId, Math.max(1, Math.min(MAX_CHECK_LIMIT, limit)));
        writeJson(exchange, 200, checks);
    }

    private void handleServices(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        writeJson(exchange, 200, destinations.supportedServices());
    }

    private List<Map<String, Object>> monitorViews() {
        Set<Long> scheduled = scheduler.scheduledMonitorIds();
        List<Map<String, Object>> views = new ArrayList<>();
        for (Monitor monitor : store.monitors()) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("id", monitor.id());
            view.put("name", monitor.name());
            view.put("kind", monitor.kind());
            view.put("target", monitor.target());
            view.put("intervalSeconds", monitor.intervalSeconds());
            view.put("active", monitor.active());
            view.put("scheduled", scheduled.contains(monitor.id()));
            Optional<Check> latest = store.latestCheck(monitor.id());
            latest.ifPresent(check -> {
                view.put("status", check.status());
                view.put("latencyMillis", check.latencyMillis());
                view.put("lastCheckedAt", check.checkedAt());
            });
            views.add(view);
        }
        return views;
    }

    private boolean ensureGet(HttpExchange exchange) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET,OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }
}
