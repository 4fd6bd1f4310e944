package com.newsboard.collectors.scoring;

import java.util.Objects;

public record SignalDefinition(String name, SignalKind kind, String pattern) {
    public SignalDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(pattern, "pattern is required");
    }
}
