package com.newsboard.core.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public record Top10Snapshot(
        String snapshotId,
        String sourceId,
        Instant observedAt,
        boolean ok,
        String error,
        List<RankedItem> items
) {
    public static final int MAX_RANK = 10;

    public Top10Snapshot {
        Objects.requireNonNull(snapshotId, "snapshotId is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
        items = items == null
                ? List.of()
                : items.stream().sorted(Comparator.comparingInt(RankedItem::rank)).toList();
        Set<Integer> ranks = new HashSet<>();
        Set<String> fingerprints = new HashSet<>();
        for (RankedItem item : items) {
            if (item.rank() > MAX_RANK) {
                throw new IllegalArgumentException("rank " + item.rank() + " exceeds " + MAX_RANK + " in " + snapshotId);
            }
            if (!ranks.add(item.rank())) {
                throw new IllegalArgumentException("duplicate rank " + item.rank() + " in " + snapshotId);
            }
            if (!fingerprints.add(item.fingerprint())) {
                throw new IllegalArgumentException("duplicate fingerprint " + item.fingerprint() + " in " + snapshotId);
            }
        }
    }

    public static Top10Snapshot failed(String snapshotId, String sourceId, Instant observedAt, String error) {
        return new Top10Snapshot(snapshotId, sourceId, observedAt, false, error, List.of());
    }

    public Map<String, RankedItem> byFingerprint() {
        Map<String, RankedItem> indexed = new LinkedHashMap<>();
        for (RankedItem item : items) {
            indexed.put(item.fingerprint(), item);
        }
        return indexed;
    }
}
