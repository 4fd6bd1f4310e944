package com.newsboard.service.remote;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsboard.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

final class SupabaseHttp {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    // Bulk inserts need identical keys on every row, so nulls are written out.
    private static final ObjectMapper ROW_MAPPER = JsonUtils.objectMapper().copy()
            .setSerializationInclusion(JsonInclude.Include.ALWAYS);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String serviceKey;
    private final Duration timeout;

    SupabaseHttp(HttpClient httpClient, String baseUrl, String serviceKey, Duration timeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Supabase url is required");
        }
        if (serviceKey == null || serviceKey.isBlank()) {
            throw new IllegalArgumentException("Supabase service role key is required");
        }
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.serviceKey = serviceKey;
        this.timeout = timeout;
    }

    String baseUrl() {
        return baseUrl;
    }

    HttpRequest.Builder request(String pathAndQuery) {
        return HttpRequest.newBuilder(URI.create(baseUrl + pathAndQuery))
                .timeout(timeout)
                .header("apikey", serviceKey)
                .header("Authorization", "Bearer " + serviceKey);
    }

    String send(HttpRequest request, String operation) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new StoreException(operation + " timed out", e);
        } catch (IOException e) {
            throw new StoreException(operation + " failed: " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException(operation + " interrupted", e);
        }
        if (response.statusCode() >= 400) {
            throw errorFrom(response.statusCode(), response.body(), operation);
        }
        return response.body();
    }

    JsonNode readTree(String body, String operation) {
        if (body == null || body.isBlank()) {
            return MAPPER.createArrayNode();
        }
        try {
            return MAPPER.readTree(body);
        } catch (IOException e) {
            throw new StoreException(operation + " returned an unreadable body", e);
        }
    }

    String json(Object value) {
        try {
            return ROW_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize request body", e);
        }
    }

    static StoreException errorFrom(int status, String body, String operation) {
        String code = null;
        String details = null;
        String hint = null;
        String message = body;
        if (body != null && body.trim().startsWith("{")) {
            try {
                JsonNode node = MAPPER.readTree(body);
                code = text(node, "code");
                details = text(node, "details");
                hint = text(node, "hint");
                String parsed = text(node, "message");
                if (parsed == null) {
                    parsed = text(node, "error");
                }
                message = parsed == null ? body : parsed;
            } catch (IOException ignored) {
                message = body;
            }
        }
        return new StoreException(status, code, details, hint,
                operation + " failed with HTTP " + status + (message == null || message.isBlank() ? "" : ": " + message));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
