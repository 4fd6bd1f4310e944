package com.newsboard.service.remote;

import java.util.Objects;

public record Filter(String column, String operator, Object value) {
    public Filter {
        Objects.requireNonNull(column, "column is required");
        Objects.requireNonNull(operator, "operator is required");
    }

    public static Filter eq(String column, Object value) {
        return new Filter(column, "eq", value);
    }

    public static Filter lt(String column, Object value) {
        return new Filter(column, "lt", value);
    }

    public static Filter gte(String column, Object value) {
        return new Filter(column, "gte", value);
    }
}
