package com.newsboard.collectors.api;

import com.newsboard.core.history.UpsertKind;
import com.newsboard.core.model.ChangeEvent;
import com.newsboard.core.model.HeroItem;
import com.newsboard.core.model.ResidencyEntry;
import com.newsboard.core.model.SourceState;
import com.newsboard.core.model.Top10Snapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface StateStore {
    UpsertKind upsertResidency(String sourceId, Instant observedAt, HeroItem item);

    Optional<Instant> residencySince(String sourceId, String url);

    List<ResidencyEntry> residency(String sourceId);

    Optional<SourceState> current(String sourceId);

    void putCurrent(SourceState state);

    Optional<Top10Snapshot> latestTop10(String sourceId);

    void putTop10(Top10Snapshot snapshot);

    void appendChanges(List<ChangeEvent> events);
}
