package com.newsboard.core.events;

import java.time.Instant;

public record CollectorRunStarted(Instant timestamp, String collectorName) implements Event {
    @Override
    public String type() {
        return "CollectorRunStarted";
    }
}
