package com.newsboard.service.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

public class SupabaseObjectStore implements ObjectStore {
    static final int LIST_PAGE_SIZE = 100;
    static final int DELETE_CHUNK_SIZE = 100;

    private final SupabaseHttp http;
    private final String bucket;

    public SupabaseObjectStore(HttpClient httpClient, String supabaseUrl, String serviceKey, String bucket, Duration timeout) {
        this.http = new SupabaseHttp(httpClient, supabaseUrl, serviceKey, timeout);
        this.bucket = bucket == null || bucket.isBlank() ? "screenshots" : bucket;
    }

    public String bucket() {
        return bucket;
    }

    @Override
    public void upload(String path, byte[] bytes, String contentType) {
        HttpRequest request = http.request("/storage/v1/object/" + bucket + "/" + encodePath(path))
                .header("Content-Type", contentType)
                .header("x-upsert", "true")
                .POST(HttpRequest.BodyPublishers.ofByteArray(bytes))
                .build();
        http.send(request, "upload " + path);
    }

    @Override
    public List<StoredObject> list(String prefix) {
        List<StoredObject> files = new ArrayList<>();
        Deque<String> folders = new ArrayDeque<>();
        folders.add(prefix == null ? "" : prefix);
        while (!folders.isEmpty()) {
            String folder = folders.poll();
            int offset = 0;
            while (true) {
                JsonNode page = listPage(folder, offset);
                if (!page.isArray() || page.isEmpty()) {
                    break;
                }
                for (JsonNode entry : page) {
                    String name = entry.path("name").asText("");
                    if (name.isEmpty()) {
                        continue;
                    }
                    String path = folder.isEmpty() ? name : folder + "/" + name;
                    if (entry.hasNonNull("id")) {
                        files.add(new StoredObject(path, parseInstant(entry.path("created_at").asText(null))));
                    } else {
                        folders.add(path);
                    }
                }
                if (page.size() < LIST_PAGE_SIZE) {
                    break;
                }
                offset += page.size();
            }
        }
        return files;
    }

    @Override
    public String signedUrl(String path, Duration ttl) {
        HttpRequest request = http.request("/storage/v1/object/sign/" + bucket + "/" + encodePath(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(http.json(Map.of("expiresIn", ttl.toSeconds()))))
                .build();
        JsonNode body = http.readTree(http.send(request, "sign " + path), "sign " + path);
        String signed = body.path("signedURL").asText(body.path("signedUrl").asText(""));
        if (signed.isEmpty()) {
            throw new StoreException(0, null, null, null, "sign " + path + " returned no url");
        }
        if (signed.startsWith("http")) {
            return signed;
        }
        return http.baseUrl() + "/storage/v1" + (signed.startsWith("/") ? signed : "/" + signed);
    }

    @Override
    public void delete(List<String> paths) {
        for (int start = 0; start < paths.size(); start += DELETE_CHUNK_SIZE) {
            List<String> chunk = paths.subList(start, Math.min(paths.size(), start + DELETE_CHUNK_SIZE));
            HttpRequest request = http.request("/storage/v1/object/" + bucket)
                    .header("Content-Type", "application/json")
                    .method("DELETE", HttpRequest.BodyPublishers.ofString(http.json(Map.of("prefixes", chunk))))
                    .build();
            http.send(request, "delete " + chunk.size() + " object(s)");
        }
    }

    private JsonNode listPage(String folder, int offset) {
        Map<String, Object> body = Map.of(
                "prefix", folder,
                "limit", LIST_PAGE_SIZE,
                "offset", offset,
                "sortBy", Map.of("column", "name", "order", "asc")
        );
        HttpRequest request = http.request("/storage/v1/object/list/" + bucket)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(http.json(body)))
                .build();
        return http.readTree(http.send(request, "list " + folder), "list " + folder);
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String encodePath(String path) {
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            segments.add(URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"));
        }
        return String.join("/", segments);
    }
}
