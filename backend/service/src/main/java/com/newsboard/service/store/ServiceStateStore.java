package com.newsboard.service.store;

import com.newsboard.collectors.api.StateStore;
import com.newsboard.core.model.ResidencyEntry;
import com.newsboard.core.model.SourceState;
import com.newsboard.core.model.Top10Snapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public interface ServiceStateStore extends StateStore {
    Map<String, SourceState> currentStates();

    Map<String, List<ResidencyEntry>> residencyBySource();

    List<Top10Snapshot> top10History(String sourceId);

    Instant generatedAt();

    int pruneResidency(Instant cutoff);

    void flush(Instant generatedAt);

    void writeDegraded(Instant generatedAt, String error);
}
