package com.newsboard.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsboard.core.model.ChangeEvent;
import com.newsboard.core.model.SourceState;
import com.newsboard.core.model.Top10Snapshot;
import com.newsboard.core.util.JsonUtils;
import com.newsboard.service.runtime.RunOrchestrator;
import com.newsboard.service.store.JsonlChangeEventStore;
import com.newsboard.service.store.ServiceStateStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());

    private final int port;
    private final ServiceStateStore stateStore;
    private final JsonlChangeEventStore changeEvents;
    private final RunOrchestrator orchestrator;
    private final Clock clock;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            ServiceStateStore stateStore,
            JsonlChangeEventStore changeEvents,
            RunOrchestrator orchestrator,
            Clock clock
    ) {
        this.port = port;
        this.stateStore = stateStore;
        this.changeEvents = changeEvents;
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(4);
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/current", this::handleCurrent);
            server.createContext("/api/cache", this::handleCurrent);
            server.createContext("/api/history", this::handleHistory);
            server.createContext("/api/events", this::handleEvents);
            server.createContext("/api/top10/latest", this::handleTop10Latest);
            server.createContext("/api/refresh", this::handleRefresh);
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
            executor.shutdown();
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
        writeJson(exchange, 200, Map.of("ok", true, "ts", clock.instant()));
    }

    private void handleCurrent(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, currentView());
    }

    private void handleHistory(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        Optional<String> source;
        try {
            source = param(exchange, "source");
        } catch (IllegalArgumentException invalidParamError) {
            writeJson(exchange, 400, Map.of("ok", false, "error", "invalid_query_params"));
            return;
        }
        if (source.isPresent()) {
            if (!orchestrator.sourceIds().contains(source.get())) {
                writeJson(exchange, 404, Map.of("ok", false, "error", "unknown_source"));
                return;
            }
            writeJson(exchange, 200, Map.of(
                    "sourceId", source.get(),
                    "entries", stateStore.residency(source.get())
            ));
            return;
        }
        Map<String, Object> sources = new LinkedHashMap<>();
        stateStore.residencyBySource().forEach((id, entries) -> sources.put(id, Map.of("entries", entries)));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("generatedAt", stateStore.generatedAt());
        body.put("sources", sources);
        writeJson(exchange, 200, body);
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }

        Instant since;
        Optional<String> source;
        int limit;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
            source = Optional.ofNullable(query.get("source")).filter(value -> !value.isBlank());
            limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : 200;
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("ok", false, "error", "invalid_query_params"));
            return;
        }
        if (source.isPresent() && !orchestrator.sourceIds().contains(source.get())) {
            writeJson(exchange, 404, Map.of("ok", false, "error", "unknown_source"));
            return;
        }

        List<ChangeEvent> events = changeEvents.query(source, since, Math.max(1, limit));
        writeJson(exchange, 200, events);
    }

    private void handleTop10Latest(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        Optional<String> source;
        try {
            source = param(exchange, "source");
        } catch (IllegalArgumentException invalidParamError) {
            writeJson(exchange, 400, Map.of("ok", false, "error", "invalid_query_params"));
            return;
        }
        if (source.isEmpty()) {
            writeJson(exchange, 400, Map.of("ok", false, "error", "source_required"));
            return;
        }
        if (!orchestrator.sourceIds().contains(source.get())) {
            writeJson(exchange, 404, Map.of("ok", false, "error", "unknown_source"));
            return;
        }
        Optional<Top10Snapshot> latest = stateStore.latestTop10(source.get());
        if (latest.isEmpty()) {
            writeJson(exchange, 404, Map.of("ok", false, "error", "no_snapshot"));
            return;
        }
        writeJson(exchange, 200, latest.get());
    }

    private void handleRefresh(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        Optional<String> sourceId;
        try {
            sourceId = requestedSource(exchange);
        } catch (IOException | RuntimeException invalidBody) {
            writeJson(exchange, 400, Map.of("ok", false, "error", "invalid_body"));
            return;
        }
        if (sourceId.isPresent() && !orchestrator.sourceIds().contains(sourceId.get())) {
            writeJson(exchange, 404, Map.of("ok", false, "error", "unknown_source"));
            return;
        }
        try {
            orchestrator.runOnce(sourceId);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Refresh failed", e);
            writeJson(exchange, 500, Map.of("ok", false, "error", String.valueOf(e.getMessage())));
            return;
        }
        writeJson(exchange, 200, Map.of("ok", true, "cache", currentView()));
    }

    private Optional<String> requestedSource(HttpExchange exchange) throws IOException {
        byte[] raw;
        try (InputStream in = exchange.getRequestBody()) {
            raw = in.readAllBytes();
        }
        if (raw.length == 0) {
            return Optional.empty();
        }
        JsonNode body = JsonUtils.objectMapper().readTree(raw);
        if (body == null || !body.hasNonNull("id")) {
            return Optional.empty();
        }
        return Optional.of(body.get("id").asText()).filter(value -> !value.isBlank());
    }

    private Map<String, Object> currentView() {
        Map<String, SourceState> states = stateStore.currentStates();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("ok", states.values().stream().anyMatch(SourceState::ok));
        view.put("generatedAt", stateStore.generatedAt());
        view.put("sources", states);
        return view;
    }

    private boolean ensureMethod(HttpExchange exchange, String method) throws IOException {
        corsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
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

    private static void corsHeaders(HttpExchange exchange) {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET,POST,OPTIONS");
        exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Optional<String> param(HttpExchange exchange, String name) {
        return Optional.ofNullable(queryParams(exchange.getRequestURI()).get(name)).filter(value -> !value.isBlank());
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
