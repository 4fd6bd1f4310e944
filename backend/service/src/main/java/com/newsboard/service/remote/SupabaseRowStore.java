package com.newsboard.service.remote;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.newsboard.core.util.JsonUtils;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class SupabaseRowStore implements RowStore {
    private final SupabaseHttp http;

    public SupabaseRowStore(HttpClient httpClient, String supabaseUrl, String serviceKey, Duration timeout) {
        this.http = new SupabaseHttp(httpClient, supabaseUrl, serviceKey, timeout);
    }

    @Override
    public List<String> insert(String table, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return List.of();
        }
        HttpRequest request = http.request("/rest/v1/" + table)
                .header("Content-Type", "application/json")
                .header("Prefer", "return=representation")
                .POST(HttpRequest.BodyPublishers.ofString(http.json(rows)))
                .build();
        JsonNode body = http.readTree(http.send(request, "insert into " + table), "insert into " + table);
        List<String> ids = new ArrayList<>();
        for (JsonNode row : body) {
            JsonNode id = row.get("id");
            if (id != null && !id.isNull()) {
                ids.add(id.asText());
            }
        }
        return ids;
    }

    @Override
    public List<Map<String, Object>> query(String table, List<Filter> filters, Order order, int limit) {
        StringBuilder query = new StringBuilder("/rest/v1/").append(table).append("?select=*");
        for (Filter filter : filters) {
            query.append('&').append(encode(filter.column())).append('=')
                    .append(filter.operator()).append('.').append(encode(String.valueOf(filter.value())));
        }
        if (order != null) {
            query.append("&order=").append(encode(order.column())).append(order.ascending() ? ".asc" : ".desc");
        }
        if (limit > 0) {
            query.append("&limit=").append(limit);
        }
        HttpRequest request = http.request(query.toString())
                .header("Accept", "application/json")
                .GET()
                .build();
        String body = http.send(request, "query " + table);
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            return JsonUtils.objectMapper().readValue(body, new TypeReference<List<Map<String, Object>>>() {
            });
        } catch (Exception e) {
            throw new StoreException("query " + table + " returned an unreadable body", e);
        }
    }

    @Override
    public void delete(String table, List<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        String inList = ids.stream().map(SupabaseRowStore::encode).collect(Collectors.joining(","));
        HttpRequest request = http.request("/rest/v1/" + table + "?id=in.(" + inList + ")")
                .DELETE()
                .build();
        http.send(request, "delete from " + table);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
