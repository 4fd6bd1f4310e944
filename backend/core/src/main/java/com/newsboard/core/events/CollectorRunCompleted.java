package com.newsboard.core.events;

import java.time.Instant;

public record CollectorRunCompleted(
        Instant timestamp,
        String collectorName,
        boolean success,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "CollectorRunCompleted";
    }
}
