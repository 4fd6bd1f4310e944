package com.newsboard.service.remote;

import com.newsboard.core.model.Top10Snapshot;
import com.newsboard.service.support.InMemoryRowStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RemoteSnapshotLoaderTest {
    @Test
    void rebuildsTheNewestSuccessfulSnapshot() {
        InMemoryRowStore rows = new InMemoryRowStore();
        rows.insert(RemoteTables.TOP10_RUNS, List.of(
                Map.of("id", "s-old", "source_id", "bbc1", "observed_at", "2026-03-04T09:00:00Z", "ok", true),
                Map.of("id", "s-new", "source_id", "bbc1", "observed_at", "2026-03-04T10:00:00Z", "ok", true),
                Map.of("id", "s-failed", "source_id", "bbc1", "observed_at", "2026-03-04T11:00:00Z", "ok", false),
                Map.of("id", "s-other", "source_id", "other", "observed_at", "2026-03-04T12:00:00Z", "ok", true)
        ));
        rows.insert(RemoteTables.TOP10_ITEMS, List.of(
                Map.of("run_id", "s-new", "rank", 2, "title", "Second story", "url", "https://www.bbc.com/news/b", "fingerprint", "fb"),
                Map.of("run_id", "s-new", "rank", 1, "title", "First story", "url", "https://www.bbc.com/news/a", "fingerprint", "fa"),
                Map.of("run_id", "s-old", "rank", 1, "title", "Old story", "url", "https://www.bbc.com/news/o", "fingerprint", "fo")
        ));

        Optional<Top10Snapshot> loaded = new RemoteSnapshotLoader(rows).latest("bbc1");

        assertTrue(loaded.isPresent());
        Top10Snapshot snapshot = loaded.get();
        assertEquals("s-new", snapshot.snapshotId());
        assertTrue(snapshot.ok());
        assertEquals(Instant.parse("2026-03-04T10:00:00Z"), snapshot.observedAt());
        assertEquals(List.of("fa", "fb"), snapshot.items().stream().map(item -> item.fingerprint()).toList());
        assertEquals(1, snapshot.items().get(0).rank());
    }

    @Test
    void emptyWhenTheSourceHasNoSuccessfulRun() {
        InMemoryRowStore rows = new InMemoryRowStore();
        rows.insert(RemoteTables.TOP10_RUNS, List.of(
                Map.of("id", "s-failed", "source_id", "bbc1", "observed_at", "2026-03-04T11:00:00Z", "ok", false)
        ));

        assertTrue(new RemoteSnapshotLoader(rows).latest("bbc1").isEmpty());
    }
}
