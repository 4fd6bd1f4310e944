package com.newsboard.core.events;

import java.time.Instant;

public record HeroChanged(
        Instant timestamp,
        String sourceId,
        String previousUrl,
        String url,
        String title,
        boolean headlineOnly
) implements Event {
    @Override
    public String type() {
        return "HeroChanged";
    }
}
