package com.trafficsentinel.service.api;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.trafficsentinel.core.util.JsonUtils;
import com.trafficsentinel.service.runtime.TrafficSystem;
import com.trafficsentinel.service.store.PhaseLogAnalytics;
import com.trafficsentinel.service.store.PhaseLogStore;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class ApiServer {
    // one century
    private static final long MAX_WINDOW_HOURS = 876_600;

    private final int port;
    private final TrafficSystem trafficSystem;
    private final PhaseLogStore phaseLogStore;
    private final PhaseLogAnalytics analytics;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(int port, TrafficSystem trafficSystem, PhaseLogStore phaseLogStore, PhaseLogAnalytics analytics) {
        this.port = port;
        this.trafficSystem = trafficSystem;
        this.phaseLogStore = phaseLogStore;
        this.analytics = analytics;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(4);
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/signals", this::handleSignals);
            server.createContext("/api/lanes", this::handleLanes);
            server.createContext("/api/monitors", this::handleMonitors);
            server.createContext("/api/statistics", this::handleStatistics);
            server.createContext("/api/logs", this::handleLogs);
            server.createContext("/api/analytics/today", this::handleTodayStats);
            server.createContext("/api/analytics/lanes", this::handleLaneStats);
            server.createContext("/api/emergency", this::handleEmergency);
            server.createContext("/api/detector/confidence", this::handleConfidence);
            server.start();
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
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleSignals(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        Map<String, Object> body = new HashMap<>();
        body.put("states", trafficSystem.getAllStates());
        body.put("currentLane", trafficSystem.scheduler().currentLane());
        body.put("mode", trafficSystem.scheduler().mode());
        writeJson(exchange, 200, body);
    }

    private void handleLanes(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, trafficSystem.getAllLaneData());
    }

    private void handleMonitors(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, trafficSystem.monitorStatus());
    }

    private void handleStatistics(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, trafficSystem.getStatistics());
    }

    private void handleLogs(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        int limit;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : 50;
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        writeJson(exchange, 200, phaseLogStore.recent(Math.max(1, limit)));
    }

    private void handleTodayStats(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, analytics.todayStats());
    }

    private void handleLaneStats(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        Duration window;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            long hours = query.containsKey("hours") ? Long.parseLong(query.get("hours")) : 24;
            if (hours < 1 || hours > MAX_WINDOW_HOURS) {
                throw new IllegalArgumentException("hours must be between 1 and " + MAX_WINDOW_HOURS);
            }
            window = Duration.ofHours(hours);
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        writeJson(exchange, 200, analytics.laneStats(window));
    }

    private void handleEmergency(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        int lane;
        try {
            lane = Integer.parseInt(queryParams(exchange.getRequestURI()).get("lane"));
            trafficSystem.forceEmergency(lane);
        } catch (IllegalArgumentException invalidLane) {
            writeJson(exchange, 400, Map.of("error", "invalid_lane"));
            return;
        }
        writeJson(exchange, 202, Map.of("lane", lane, "status", "override_pending"));
    }

    private void handleConfidence(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        try {
            double value = Double.parseDouble(queryParams(exchange.getRequestURI()).get("value"));
            trafficSystem.updateConfidence(value);
        } catch (NullPointerException | IllegalArgumentException invalidValue) {
            writeJson(exchange, 400, Map.of("error", "invalid_confidence"));
            return;
        } catch (IllegalStateException unsupported) {
            writeJson(exchange, 409, Map.of("error", "confidence_unsupported"));
            return;
        }
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(204, -1);
        exchange.close();
    }

    private boolean ensureMethod(HttpExchange exchange, String method) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", method + ",OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
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
