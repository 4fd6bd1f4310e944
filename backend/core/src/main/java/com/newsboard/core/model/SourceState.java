package com.newsboard.core.model;

import java.time.Instant;

public record SourceState(
        String sourceId,
        String name,
        boolean ok,
        Instant updatedAt,
        String error,
        String runId,
        Instant since,
        HeroItem item
) {
    public static SourceState notRefreshed(String sourceId, String name) {
        return new SourceState(sourceId, name, false, null, "Not refreshed yet", null, null, null);
    }

    public static SourceState fromRun(String name, SourceRun run, Instant since) {
        return new SourceState(run.sourceId(), name, run.ok(), run.observedAt(), run.error(), run.runId(), since, run.item());
    }
}
