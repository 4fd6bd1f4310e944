package com.newsboard.service.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsboard.core.util.JsonUtils;
import com.newsboard.service.support.StubHttpServer;
import com.newsboard.service.support.StubHttpServer.RecordedRequest;
import com.newsboard.service.support.StubHttpServer.StubResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SupabaseObjectStoreTest {
    private StubHttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    @Test
    void uploadUpsertsIntoTheBucket() throws Exception {
        server = new StubHttpServer(request -> StubResponse.json(200, "{\"Key\":\"screenshots/x\"}"));
        byte[] jpeg = "jpeg-bytes".getBytes(StandardCharsets.UTF_8);

        store().upload("screenshots/cnn1/2026/03/04/run-1.jpg", jpeg, "image/jpeg");

        RecordedRequest request = server.lastRequest();
        assertEquals("POST", request.method());
        assertEquals("/storage/v1/object/screenshots/screenshots/cnn1/2026/03/04/run-1.jpg", request.path());
        assertEquals("true", request.header("x-upsert"));
        assertEquals("image/jpeg", request.header("Content-Type"));
        assertArrayEquals(jpeg, request.body());
    }

    @Test
    void signedUrlIsMadeAbsolute() throws Exception {
        server = new StubHttpServer(request -> StubResponse.json(200,
                "{\"signedURL\":\"/object/sign/screenshots/a.jpg?token=abc\"}"));

        String url = store().signedUrl("a.jpg", Duration.ofHours(12));

        assertEquals(server.baseUrl() + "/storage/v1/object/sign/screenshots/a.jpg?token=abc", url);
        RecordedRequest request = server.lastRequest();
        assertEquals("/storage/v1/object/sign/screenshots/a.jpg", request.path());
        assertEquals(43200, JsonUtils.objectMapper().readTree(request.bodyText()).get("expiresIn").asInt());
    }

    @Test
    void signingWithoutUrlInResponseFails() throws Exception {
        server = new StubHttpServer(request -> StubResponse.json(200, "{}"));

        assertThrows(StoreException.class, () -> store().signedUrl("a.jpg", Duration.ofMinutes(5)));
    }

    @Test
    void listWalksFoldersRecursively() throws Exception {
        server = new StubHttpServer(request -> {
            String prefix = prefixOf(request);
            if (prefix.equals("screenshots")) {
                return StubResponse.json(200, "[{\"name\":\"cnn1\",\"id\":null},"
                        + "{\"name\":\"stray.jpg\",\"id\":\"1\",\"created_at\":\"2026-03-01T00:00:00Z\"}]");
            }
            if (prefix.equals("screenshots/cnn1")) {
                return StubResponse.json(200, "[{\"name\":\"run-1.jpg\",\"id\":\"2\",\"created_at\":\"2026-03-04T10:00:00Z\"}]");
            }
            return StubResponse.json(200, "[]");
        });

        List<StoredObject> objects = new ArrayList<>(store().list("screenshots"));
        objects.sort(Comparator.comparing(StoredObject::path));

        assertEquals(2, objects.size());
        assertEquals("screenshots/cnn1/run-1.jpg", objects.get(0).path());
        assertEquals(Instant.parse("2026-03-04T10:00:00Z"), objects.get(0).createdAt());
        assertEquals("screenshots/stray.jpg", objects.get(1).path());
    }

    @Test
    void deleteSendsPrefixesInChunks() throws Exception {
        server = new StubHttpServer(request -> StubResponse.json(200, "[]"));
        List<String> paths = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            paths.add("screenshots/cnn1/run-" + i + ".jpg");
        }

        store().delete(paths);

        List<RecordedRequest> requests = server.requests();
        assertEquals(2, requests.size());
        assertEquals("DELETE", requests.get(0).method());
        assertEquals("/storage/v1/object/screenshots", requests.get(0).path());
        assertEquals(100, JsonUtils.objectMapper().readTree(requests.get(0).bodyText()).get("prefixes").size());
        assertEquals(50, JsonUtils.objectMapper().readTree(requests.get(1).bodyText()).get("prefixes").size());
    }

    private SupabaseObjectStore store() {
        return new SupabaseObjectStore(HttpClient.newHttpClient(), server.baseUrl(), "service-key", null, Duration.ofSeconds(5));
    }

    private static String prefixOf(RecordedRequest request) {
        try {
            JsonNode body = JsonUtils.objectMapper().readTree(request.bodyText());
            return body.path("prefix").asText("");
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
