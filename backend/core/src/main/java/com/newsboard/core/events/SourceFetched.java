package com.newsboard.core.events;

import java.time.Instant;

public record SourceFetched(
        Instant timestamp,
        String sourceId,
        String url,
        boolean ok,
        String failure,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SourceFetched";
    }
}
