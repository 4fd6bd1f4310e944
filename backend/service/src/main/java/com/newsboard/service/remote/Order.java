package com.newsboard.service.remote;

import java.util.Objects;

public record Order(String column, boolean ascending) {
    public Order {
        Objects.requireNonNull(column, "column is required");
    }

    public static Order asc(String column) {
        return new Order(column, true);
    }

    public static Order desc(String column) {
        return new Order(column, false);
    }
}
