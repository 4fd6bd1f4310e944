package com.newsboard.core.model;

import java.time.Instant;
import java.util.Objects;

public record SourceRun(
        String runId,
        String sourceId,
        Instant observedAt,
        boolean ok,
        String error,
        FailureKind failure,
        HeroItem item
) {
    public SourceRun {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
        if (ok && item == null) {
            throw new IllegalArgumentException("successful run for " + sourceId + " must carry an item");
        }
        if (!ok && failure == null) {
            throw new IllegalArgumentException("failed run for " + sourceId + " must carry a failure kind");
        }
    }

    public static SourceRun success(String runId, String sourceId, Instant observedAt, HeroItem item) {
        return new SourceRun(runId, sourceId, observedAt, true, null, null, item);
    }

    public static SourceRun failure(String runId, String sourceId, Instant observedAt, FailureKind failure, String error) {
        return new SourceRun(runId, sourceId, observedAt, false, error, failure, null);
    }
}
