package com.newsboard.core.diff;

import com.newsboard.core.model.ChangeEvent;
import com.newsboard.core.model.ChangeEventType;
import com.newsboard.core.model.RankedItem;
import com.newsboard.core.model.Top10Snapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns two consecutive ranked snapshots into typed change events.
 *
 * <p>Fingerprints are compared independently. A fingerprint only in {@code current} entered, one only in
 * {@code previous} exited, and one in both may have moved and/or had its title updated. Output order is
 * entered (by current rank), then moved/title-updated (by current rank, moved first), then exited (by
 * previous rank).
 */
public final class RankedListDiff {
    private RankedListDiff() {
    }

    public static List<ChangeEvent> diff(Top10Snapshot previous, Top10Snapshot current) {
        Objects.requireNonNull(current, "current snapshot is required");
        if (!current.ok()) {
            return List.of();
        }
        Map<String, RankedItem> before = previous == null ? Map.of() : previous.byFingerprint();
        Map<String, RankedItem> after = current.byFingerprint();
        String fromId = previous == null ? null : previous.snapshotId();
        String toId = current.snapshotId();

        List<ChangeEvent> entered = new ArrayList<>();
        List<ChangeEvent> changed = new ArrayList<>();
        for (RankedItem now : current.items()) {
            RankedItem was = before.get(now.fingerprint());
            if (was == null) {
                entered.add(event(current, ChangeEventType.ENTERED, now.fingerprint(),
                        null, now.rank(), null, now.title(), fromId, toId));
                continue;
            }
            if (was.rank() != now.rank()) {
                changed.add(event(current, ChangeEventType.MOVED, now.fingerprint(),
                        was.rank(), now.rank(), was.title(), now.title(), fromId, toId));
            }
            if (!was.title().equals(now.title())) {
                changed.add(event(current, ChangeEventType.TITLE_UPDATED, now.fingerprint(),
                        was.rank(), now.rank(), was.title(), now.title(), fromId, toId));
            }
        }

        List<ChangeEvent> exited = new ArrayList<>();
        if (previous != null) {
            previous.items().stream()
                    .sorted(Comparator.comparingInt(RankedItem::rank))
                    .filter(was -> !after.containsKey(was.fingerprint()))
                    .forEach(was -> exited.add(event(current, ChangeEventType.EXITED, was.fingerprint(),
                            was.rank(), null, was.title(), null, fromId, toId)));
        }

        List<ChangeEvent> events = new ArrayList<>(entered.size() + changed.size() + exited.size());
        events.addAll(entered);
        events.addAll(changed);
        events.addAll(exited);
        return List.copyOf(events);
    }

    private static ChangeEvent event(
            Top10Snapshot current,
            ChangeEventType type,
            String fingerprint,
            Integer fromRank,
            Integer toRank,
            String fromTitle,
            String toTitle,
            String fromSnapshotId,
            String toSnapshotId
    ) {
        return new ChangeEvent(
                current.sourceId(),
                current.observedAt(),
                type,
                fingerprint,
                fromRank,
                toRank,
                fromTitle,
                toTitle,
                fromSnapshotId,
                toSnapshotId
        );
    }
}
