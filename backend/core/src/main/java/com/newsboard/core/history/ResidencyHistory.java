package com.newsboard.core.history;

import com.newsboard.core.model.HeroItem;
import com.newsboard.core.model.ResidencyEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Only the last entry of a source ever changes. An observation older than the last sighting (clock
 * correction, data moved between hosts) is still accepted and never moves {@code lastSeenAt} back.
 */
public final class ResidencyHistory {
    private final Map<String, List<ResidencyEntry>> entriesBySource = new LinkedHashMap<>();

    public ResidencyHistory() {
    }

    public ResidencyHistory(Map<String, List<ResidencyEntry>> initial) {
        if (initial != null) {
            initial.forEach((sourceId, entries) -> entriesBySource.put(sourceId, new ArrayList<>(entries)));
        }
    }

    public synchronized UpsertKind upsert(String sourceId, Instant observedAt, HeroItem item) {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
        if (item == null) {
            return UpsertKind.NONE;
        }
        List<ResidencyEntry> entries = entriesBySource.computeIfAbsent(sourceId, ignored -> new ArrayList<>());
        if (entries.isEmpty()) {
            entries.add(ResidencyEntry.start(item, observedAt));
            return UpsertKind.NEW_URL;
        }

        int lastIndex = entries.size() - 1;
        ResidencyEntry last = entries.get(lastIndex);
        if (last.url().equals(item.url()) && last.title().equals(item.title())) {
            Instant seenAt = observedAt.isBefore(last.lastSeenAt()) ? last.lastSeenAt() : observedAt;
            entries.set(lastIndex, last.extend(seenAt, item.imageUrl()));
            return UpsertKind.EXTENDED;
        }
        entries.add(ResidencyEntry.start(item, observedAt));
        return last.url().equals(item.url()) ? UpsertKind.NEW_TITLE : UpsertKind.NEW_URL;
    }

    /**
     * When the given url first took the top slot in its current, unbroken run, across any number of
     * headline edits. Empty when the latest entry belongs to a different url.
     */
    public synchronized Optional<Instant> sinceFor(String sourceId, String currentUrl) {
        List<ResidencyEntry> entries = entriesBySource.get(sourceId);
        if (entries == null || entries.isEmpty() || currentUrl == null) {
            return Optional.empty();
        }
        int index = entries.size() - 1;
        if (!entries.get(index).url().equals(currentUrl)) {
            return Optional.empty();
        }
        while (index > 0 && entries.get(index - 1).url().equals(currentUrl)) {
            index--;
        }
        return Optional.of(entries.get(index).firstSeenAt());
    }

    public synchronized List<ResidencyEntry> entries(String sourceId) {
        return List.copyOf(entriesBySource.getOrDefault(sourceId, List.of()));
    }

    public synchronized Optional<ResidencyEntry> last(String sourceId) {
        List<ResidencyEntry> entries = entriesBySource.get(sourceId);
        return entries == null || entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    public synchronized Set<String> sources() {
        return Set.copyOf(entriesBySource.keySet());
    }

    public synchronized int prune(Instant cutoff) {
        int removed = 0;
        for (List<ResidencyEntry> entries : entriesBySource.values()) {
            int before = entries.size();
            entries.removeIf(entry -> entry.lastSeenAt().isBefore(cutoff));
            removed += before - entries.size();
        }
        return removed;
    }

    public synchronized Map<String, List<ResidencyEntry>> snapshot() {
        Map<String, List<ResidencyEntry>> copy = new LinkedHashMap<>();
        entriesBySource.forEach((sourceId, entries) -> copy.put(sourceId, List.copyOf(entries)));
        return copy;
    }
}
