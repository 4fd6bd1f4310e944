package com.newsboard.core.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public record Candidate(
        String title,
        String url,
        String imageUrl,
        Map<String, Object> signals
) {
    public Candidate {
        title = title == null ? "" : title;
        url = url == null ? "" : url;
        signals = signals == null ? Map.of() : Map.copyOf(signals);
    }

    public boolean flag(String signal) {
        return Boolean.TRUE.equals(signals.get(signal));
    }

    public Double number(String signal) {
        Object value = signals.get(signal);
        return value instanceof Number number ? number.doubleValue() : null;
    }

    public Candidate withSignal(String signal, Object value) {
        Objects.requireNonNull(signal, "signal is required");
        Map<String, Object> next = new HashMap<>(signals);
        next.put(signal, value);
        return new Candidate(title, url, imageUrl, next);
    }
}
