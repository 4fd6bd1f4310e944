package com.newsboard.collectors.api;

import com.newsboard.core.history.UpsertKind;
import com.newsboard.core.model.ChangeEvent;
import com.newsboard.core.model.SourceRun;
import com.newsboard.core.model.Top10Snapshot;

import java.util.List;
import java.util.Optional;

public interface RunRecorder {
    RunRecorder NOOP = new RunRecorder() {
        @Override
        public void recordHero(SourceRun run, UpsertKind kind, Optional<Screenshot> screenshot) {
        }

        @Override
        public void recordTop10(Top10Snapshot snapshot, List<ChangeEvent> events) {
        }
    };

    void recordHero(SourceRun run, UpsertKind kind, Optional<Screenshot> screenshot);

    void recordTop10(Top10Snapshot snapshot, List<ChangeEvent> events);
}
