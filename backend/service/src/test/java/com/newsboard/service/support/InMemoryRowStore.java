package com.newsboard.service.support;

import com.newsboard.service.remote.Filter;
import com.newsboard.service.remote.Order;
import com.newsboard.service.remote.RowStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tables as lists of rows. Rows without an {@code id} get a sequential one. Values are compared as
 * strings, which keeps ISO timestamps ordered.
 */
public class InMemoryRowStore implements RowStore {
    private final Map<String, List<Map<String, Object>>> tables = new HashMap<>();
    private final Map<String, Deque<RuntimeException>> insertFailures = new HashMap<>();
    private final Map<String, Deque<RuntimeException>> deleteFailures = new HashMap<>();
    private final Map<String, AtomicInteger> insertCalls = new HashMap<>();
    private final AtomicInteger nextId = new AtomicInteger();

    public synchronized void failInserts(String table, RuntimeException... failures) {
        insertFailures.computeIfAbsent(table, ignored -> new ArrayDeque<>()).addAll(List.of(failures));
    }

    public synchronized void failDeletes(String table, RuntimeException... failures) {
        deleteFailures.computeIfAbsent(table, ignored -> new ArrayDeque<>()).addAll(List.of(failures));
    }

    public synchronized List<Map<String, Object>> rows(String table) {
        return List.copyOf(tables.getOrDefault(table, List.of()));
    }

    public synchronized int insertCalls(String table) {
        AtomicInteger calls = insertCalls.get(table);
        return calls == null ? 0 : calls.get();
    }

    @Override
    public synchronized List<String> insert(String table, List<Map<String, Object>> rows) {
        insertCalls.computeIfAbsent(table, ignored -> new AtomicInteger()).incrementAndGet();
        Deque<RuntimeException> failures = insertFailures.get(table);
        if (failures != null && !failures.isEmpty()) {
            throw failures.poll();
        }
        List<String> ids = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Map<String, Object> stored = new LinkedHashMap<>(row);
            stored.putIfAbsent("id", "row-" + nextId.incrementAndGet());
            tables.computeIfAbsent(table, ignored -> new ArrayList<>()).add(stored);
            ids.add(String.valueOf(stored.get("id")));
        }
        return ids;
    }

    @Override
    public synchronized List<Map<String, Object>> query(String table, List<Filter> filters, Order order, int limit) {
        List<Map<String, Object>> matches = new ArrayList<>();
        for (Map<String, Object> row : tables.getOrDefault(table, List.of())) {
            if (filters.stream().allMatch(filter -> matches(row, filter))) {
                matches.add(row);
            }
        }
        if (order != null) {
            Comparator<Map<String, Object>> byColumn = Comparator.comparing(row -> sortKey(row.get(order.column())));
            matches.sort(order.ascending() ? byColumn : byColumn.reversed());
        }
        return List.copyOf(limit > 0 && matches.size() > limit ? matches.subList(0, limit) : matches);
    }

    @Override
    public synchronized void delete(String table, List<String> ids) {
        Deque<RuntimeException> failures = deleteFailures.get(table);
        if (failures != null && !failures.isEmpty()) {
            throw failures.poll();
        }
        List<Map<String, Object>> rows = tables.get(table);
        if (rows != null) {
            rows.removeIf(row -> ids.contains(String.valueOf(row.get("id"))));
        }
    }

    private static boolean matches(Map<String, Object> row, Filter filter) {
        String actual = String.valueOf(row.get(filter.column()));
        String expected = String.valueOf(filter.value());
        return switch (filter.operator()) {
            case "eq" -> actual.equals(expected);
            case "lt" -> actual.compareTo(expected) < 0;
            case "gte" -> actual.compareTo(expected) >= 0;
            default -> throw new IllegalArgumentException("Unsupported operator " + filter.operator());
        };
    }

    private static String sortKey(Object value) {
        if (value instanceof Number number) {
            return String.format("%020d", number.longValue());
        }
        return String.valueOf(value);
    }
}
