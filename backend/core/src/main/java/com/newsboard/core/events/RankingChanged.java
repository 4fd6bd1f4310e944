package com.newsboard.core.events;

import java.time.Instant;

public record RankingChanged(
        Instant timestamp,
        String sourceId,
        int entered,
        int exited,
        int moved,
        int titleUpdated
) implements Event {
    @Override
    public String type() {
        return "RankingChanged";
    }
}
