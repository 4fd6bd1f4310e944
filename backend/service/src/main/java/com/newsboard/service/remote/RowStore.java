package com.newsboard.service.remote;

import java.util.List;
import java.util.Map;

public interface RowStore {
    List<String> insert(String table, List<Map<String, Object>> rows);

    default String insert(String table, Map<String, Object> row) {
        List<String> ids = insert(table, List.of(row));
        return ids.isEmpty() ? null : ids.get(0);
    }

    List<Map<String, Object>> query(String table, List<Filter> filters, Order order, int limit);

    void delete(String table, List<String> ids);
}
