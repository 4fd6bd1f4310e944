package com.newsboard.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsboard.collectors.api.CollectorContext;
import com.newsboard.collectors.api.RunRecorder;
import com.newsboard.collectors.hero.HeroCollector;
import com.newsboard.collectors.hero.HeroCollectorConfig;
import com.newsboard.collectors.page.JsoupPageDriverFactory;
import com.newsboard.collectors.top10.Top10Collector;
import com.newsboard.collectors.top10.Top10CollectorConfig;
import com.newsboard.core.bus.EventBus;
import com.newsboard.core.model.ChangeEvent;
import com.newsboard.core.model.ChangeEventType;
import com.newsboard.core.model.RankedItem;
import com.newsboard.core.model.Top10Snapshot;
import com.newsboard.core.util.JsonUtils;
import com.newsboard.service.runtime.RunOrchestrator;
import com.newsboard.service.store.JsonFileStateStore;
import com.newsboard.service.store.JsonlChangeEventStore;
import com.newsboard.service.support.FrontPages;
import com.newsboard.service.support.MutableClock;
import com.newsboard.service.support.StubHttpServer;
import com.newsboard.service.support.StubHttpServer.StubResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiServerIntegrationTest {
    private static final Instant T0 = Instant.parse("2026-03-04T10:00:00Z");

    private final HttpClient client = HttpClient.newHttpClient();
    private StubHttpServer site;
    private ApiServer apiServer;
    private JsonFileStateStore stateStore;
    private JsonlChangeEventStore changeEvents;

    @BeforeEach
    void setUp() throws Exception {
        site = new StubHttpServer(request -> request.path().equals("/front")
                ? StubResponse.html(200, FrontPages.lead(FrontPages.STORM_TITLE, "/news/storm"))
                : StubResponse.html(404, "<html><head><title>Not found</title></head></html>"));
        Path dataDir = Files.createTempDirectory("api-server-");
        changeEvents = new JsonlChangeEventStore(dataDir.resolve("change-events.jsonl"));
        stateStore = new JsonFileStateStore(dataDir, changeEvents);
        stateStore.registerSource("site1", "SITE1 News");
        MutableClock clock = new MutableClock(T0);

        CollectorContext context = new CollectorContext(
                new JsoupPageDriverFactory(HttpClient.newHttpClient()),
                new EventBus(),
                stateStore,
                RunRecorder.NOOP,
                clock,
                Duration.ofSeconds(5),
                Duration.ofSeconds(1),
                Map.of(
                        HeroCollector.CONFIG_KEY, new HeroCollectorConfig(
                                List.of(FrontPages.leadSource("site1", site.baseUrl() + "/front")), null),
                        Top10Collector.CONFIG_KEY, new Top10CollectorConfig(
                                List.of(FrontPages.rankedSource("ranked1", site.baseUrl() + "/most-read")))
                )
        );
        RunOrchestrator orchestrator = new RunOrchestrator(
                List.of(new HeroCollector(), new Top10Collector()), context, stateStore);

        apiServer = new ApiServer(0, stateStore, changeEvents, orchestrator, clock);
        apiServer.start();
    }

    @AfterEach
    void tearDown() {
        if (apiServer != null) {
            apiServer.stop();
        }
        site.close();
    }

    @Test
    void healthEndpointReturnsOk() throws Exception {
        HttpResponse<String> response = get("/api/health");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertTrue(body.get("ok").asBoolean());
        assertEquals(T0.toString(), body.get("ts").asText());
        assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(""));
    }

    @Test
    void currentListsRegisteredSourcesBeforeAnyRefresh() throws Exception {
        JsonNode current = json(get("/api/current"));
        JsonNode cache = json(get("/api/cache"));

        assertEquals("Not refreshed yet", current.get("sources").get("site1").get("error").asText());
        assertEquals(current.get("sources"), cache.get("sources"));
    }

    @Test
    void refreshRunsTheSourceAndReturnsTheNewCache() throws Exception {
        HttpResponse<String> response = post("/api/refresh", "{\"id\":\"site1\"}");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertTrue(body.get("ok").asBoolean());
        JsonNode site1 = body.get("cache").get("sources").get("site1");
        assertTrue(site1.get("ok").asBoolean());
        assertEquals(FrontPages.STORM_TITLE, site1.get("item").get("title").asText());

        JsonNode history = json(get("/api/history?source=site1"));
        assertEquals("site1", history.get("sourceId").asText());
        assertEquals(1, history.get("entries").size());
        JsonNode allHistory = json(get("/api/history"));
        assertEquals(1, allHistory.get("sources").get("site1").get("entries").size());
    }

    @Test
    void refreshRejectsUnknownSourcesAndBrokenBodies() throws Exception {
        HttpResponse<String> unknown = post("/api/refresh", "{\"id\":\"nope\"}");
        HttpResponse<String> broken = post("/api/refresh", "{not json");

        assertEquals(404, unknown.statusCode());
        assertEquals("unknown_source", json(unknown).get("error").asText());
        assertEquals(400, broken.statusCode());
        assertEquals("invalid_body", json(broken).get("error").asText());
    }

    @Test
    void eventsSupportSourceSinceAndLimit() throws Exception {
        changeEvents.append(List.of(
                new ChangeEvent("ranked1", T0, ChangeEventType.ENTERED, "f1", null, 1, null, "One", null, "s-1"),
                new ChangeEvent("ranked1", T0.plusSeconds(60), ChangeEventType.MOVED, "f1", 1, 2, null, null, "s-1", "s-2")
        ));

        JsonNode all = json(get("/api/events?source=ranked1"));
        JsonNode newest = json(get("/api/events?limit=1"));
        JsonNode since = json(get("/api/events?since=2026-03-04T10:00:30Z"));

        assertEquals(2, all.size());
        assertEquals("MOVED", newest.get(0).get("eventType").asText());
        assertEquals(1, since.size());
        assertEquals(400, get("/api/events?since=yesterday").statusCode());
        assertEquals(400, get("/api/events?limit=many").statusCode());
        assertEquals(404, get("/api/events?source=nope").statusCode());
    }

    @Test
    void latestRankedSnapshotNeedsAKnownSourceWithData() throws Exception {
        HttpResponse<String> missingParam = get("/api/top10/latest");
        HttpResponse<String> unknown = get("/api/top10/latest?source=nope");
        HttpResponse<String> empty = get("/api/top10/latest?source=ranked1");

        assertEquals(400, missingParam.statusCode());
        assertEquals("source_required", json(missingParam).get("error").asText());
        assertEquals(404, unknown.statusCode());
        assertEquals("no_snapshot", json(empty).get("error").asText());

        stateStore.putTop10(new Top10Snapshot("s-1", "ranked1", T0, true, null, List.of(
                RankedItem.of(1, "First most read story of the day", "https://example.test/news/a"))));
        HttpResponse<String> latest = get("/api/top10/latest?source=ranked1");

        assertEquals(200, latest.statusCode());
        assertEquals("s-1", json(latest).get("snapshotId").asText());
        assertEquals(1, json(latest).get("items").size());
    }

    @Test
    void currentIsOkOnlyOnceSomeSourceHasBeenReadSuccessfully() throws Exception {
        assertFalse(json(get("/api/current")).get("ok").asBoolean());

        post("/api/refresh", "{\"id\":\"site1\"}");

        assertTrue(json(get("/api/current")).get("ok").asBoolean());
    }

    @Test
    void malformedPercentEscapeInSourceIsABadRequest() throws Exception {
        assertTrue(rawGet("/api/history?source=%zz").startsWith("HTTP/1.1 400"));
        assertTrue(rawGet("/api/top10/latest?source=%zz").startsWith("HTTP/1.1 400"));
        assertEquals(200, get("/api/health").statusCode());
    }

    @Test
    void wrongMethodIsRejectedAndPreflightIsAnswered() throws Exception {
        HttpResponse<String> wrongMethod = client.send(
                HttpRequest.newBuilder(uri("/api/refresh")).GET().build(),
                HttpResponse.BodyHandlers.ofString()
        );
        HttpResponse<String> preflight = client.send(
                HttpRequest.newBuilder(uri("/api/refresh")).method("OPTIONS", HttpRequest.BodyPublishers.noBody()).build(),
                HttpResponse.BodyHandlers.ofString()
        );

        assertEquals(405, wrongMethod.statusCode());
        assertEquals(204, preflight.statusCode());
        assertTrue(preflight.headers().firstValue("Access-Control-Allow-Methods").orElse("").contains("POST"));
        assertFalse(stateStore.current("site1").orElseThrow().ok());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private String rawGet(String target) throws Exception {
        try (Socket socket = new Socket("127.0.0.1", apiServer.actualPort())) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            out.write(("GET " + target + " HTTP/1.1\r\nHost: localhost\r\nConnection: close\r\n\r\n")
                    .getBytes(StandardCharsets.US_ASCII));
            out.flush();
            BufferedReader in = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
            String statusLine = in.readLine();
            return statusLine == null ? "" : statusLine;
        }
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return client.send(
                HttpRequest.newBuilder(uri(path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString()
        );
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + apiServer.actualPort() + path);
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return JsonUtils.objectMapper().readTree(response.body());
    }
}
