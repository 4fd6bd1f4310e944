package com.newsboard.core.model;

import java.time.Instant;
import java.util.Objects;

public record ChangeEvent(
        String sourceId,
        Instant observedAt,
        ChangeEventType eventType,
        String fingerprint,
        Integer fromRank,
        Integer toRank,
        String fromTitle,
        String toTitle,
        String fromSnapshotId,
        String toSnapshotId
) {
    public ChangeEvent {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
        Objects.requireNonNull(eventType, "eventType is required");
        Objects.requireNonNull(fingerprint, "fingerprint is required");
    }
}
