package com.newsboard.service.remote;

import com.newsboard.core.model.RankedItem;
import com.newsboard.core.model.Top10Snapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class RemoteSnapshotLoader {
    private final RowStore rowStore;

    public RemoteSnapshotLoader(RowStore rowStore) {
        this.rowStore = rowStore;
    }

    public Optional<Top10Snapshot> latest(String sourceId) {
        List<Map<String, Object>> runs = rowStore.query(
                RemoteTables.TOP10_RUNS,
                List.of(Filter.eq("source_id", sourceId), Filter.eq("ok", true)),
                Order.desc("observed_at"),
                1
        );
        if (runs.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> run = runs.get(0);
        String runId = String.valueOf(run.get("id"));
        List<Map<String, Object>> rows = rowStore.query(
                RemoteTables.TOP10_ITEMS,
                List.of(Filter.eq("run_id", runId)),
                Order.asc("rank"),
                Top10Snapshot.MAX_RANK
        );
        List<RankedItem> items = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            items.add(new RankedItem(
                    ((Number) row.get("rank")).intValue(),
                    (String) row.get("title"),
                    (String) row.get("url"),
                    (String) row.get("fingerprint")
            ));
        }
        return Optional.of(new Top10Snapshot(
                runId,
                sourceId,
                Instant.parse(String.valueOf(run.get("observed_at"))),
                true,
                null,
                items
        ));
    }
}
