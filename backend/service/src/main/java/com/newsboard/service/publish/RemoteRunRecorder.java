package com.newsboard.service.publish;

import com.newsboard.collectors.api.RunRecorder;
import com.newsboard.collectors.api.Screenshot;
import com.newsboard.core.history.UpsertKind;
import com.newsboard.core.model.ChangeEvent;
import com.newsboard.core.model.HeroItem;
import com.newsboard.core.model.RankedItem;
import com.newsboard.core.model.SourceRun;
import com.newsboard.core.model.Top10Snapshot;
import com.newsboard.service.remote.ObjectPaths;
import com.newsboard.service.remote.ObjectStore;
import com.newsboard.service.remote.RemoteTables;
import com.newsboard.service.remote.RowStore;
import com.newsboard.service.write.BatchOutcome;
import com.newsboard.service.write.RetryingWriter;
import com.newsboard.service.write.WriteBatch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

public class RemoteRunRecorder implements RunRecorder {
    private static final Logger LOGGER = Logger.getLogger(RemoteRunRecorder.class.getName());

    private final RowStore rowStore;
    private final ObjectStore objectStore;
    private final RetryingWriter writer;
    private final String objectPrefix;
    private final Duration signedUrlTtl;
    private WriteBatch batch;

    public RemoteRunRecorder(
            RowStore rowStore,
            ObjectStore objectStore,
            RetryingWriter writer,
            String objectPrefix,
            Duration signedUrlTtl
    ) {
        this.rowStore = rowStore;
        this.objectStore = objectStore;
        this.writer = writer;
        this.objectPrefix = objectPrefix;
        this.signedUrlTtl = signedUrlTtl;
        this.batch = new WriteBatch(writer);
    }

    @Override
    public synchronized void recordHero(SourceRun run, UpsertKind kind, Optional<Screenshot> screenshot) {
        String runLabel = "source_run " + run.sourceId() + " " + run.runId();
        Map<String, Object> runRow = sourceRunRow(run);
        batch.add(runLabel, () -> rowStore.insert(RemoteTables.SOURCE_RUNS, runRow));

        if (screenshot.isEmpty() || objectStore == null || !run.ok()) {
            return;
        }
        Screenshot shot = screenshot.get();
        String objectPath = ObjectPaths.forRun(objectPrefix, run.sourceId(), run.observedAt(), run.runId(), shot.extension());
        AtomicReference<String> shotUrl = new AtomicReference<>();
        String uploadLabel = "screenshot_upload " + run.sourceId() + " " + run.runId();
        batch.add(uploadLabel, () -> {
            objectStore.upload(objectPath, shot.bytes(), shot.contentType());
            shotUrl.set(signQuietly(objectPath));
        });
        batch.add("screenshot_event " + run.sourceId() + " " + run.runId(), uploadLabel,
                () -> rowStore.insert(RemoteTables.SCREENSHOT_EVENTS, screenshotRow(run, kind, objectPath, shotUrl.get())));
    }

    @Override
    public synchronized void recordTop10(Top10Snapshot snapshot, List<ChangeEvent> events) {
        String runLabel = "top10_run " + snapshot.sourceId() + " " + snapshot.snapshotId();
        Map<String, Object> runRow = new LinkedHashMap<>();
        runRow.put("id", snapshot.snapshotId());
        runRow.put("source_id", snapshot.sourceId());
        runRow.put("observed_at", snapshot.observedAt().toString());
        runRow.put("ok", snapshot.ok());
        runRow.put("error", snapshot.error());
        batch.add(runLabel, () -> rowStore.insert(RemoteTables.TOP10_RUNS, runRow));

        if (!snapshot.items().isEmpty()) {
            List<Map<String, Object>> itemRows = new ArrayList<>();
            for (RankedItem item : snapshot.items()) {
                itemRows.add(itemRow(snapshot, item));
            }
            batch.add("top10_items " + snapshot.sourceId() + " " + snapshot.snapshotId(), runLabel,
                    () -> rowStore.insert(RemoteTables.TOP10_ITEMS, itemRows));
        }
        if (!events.isEmpty()) {
            List<Map<String, Object>> eventRows = events.stream().map(RemoteRunRecorder::eventRow).toList();
            batch.add("top10_events " + snapshot.sourceId() + " " + snapshot.snapshotId(), runLabel,
                    () -> rowStore.insert(RemoteTables.TOP10_EVENTS, eventRows));
        }
    }

    public synchronized BatchOutcome flush() {
        WriteBatch queued = batch;
        batch = new WriteBatch(writer);
        if (queued.size() == 0) {
            return BatchOutcome.EMPTY;
        }
        BatchOutcome outcome = queued.run();
        LOGGER.info("Store batch: " + outcome.succeeded().size() + " written, "
                + outcome.failures().size() + " failed, " + outcome.skipped().size() + " skipped"
                + (outcome.breakerTripped() ? " (breaker tripped)" : ""));
        return outcome;
    }

    public synchronized int pending() {
        return batch.size();
    }

    private String signQuietly(String objectPath) {
        try {
            return objectStore.signedUrl(objectPath, signedUrlTtl);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Signing " + objectPath + " failed, storing event without url", e);
            return null;
        }
    }

    static String screenshotKind(UpsertKind kind) {
        return switch (kind) {
            case NEW_URL -> "new_url";
            case NEW_TITLE -> "new_headline";
            case EXTENDED, NONE -> "heartbeat";
        };
    }

    private static Map<String, Object> sourceRunRow(SourceRun run) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", run.runId());
        row.put("source_id", run.sourceId());
        row.put("observed_at", run.observedAt().toString());
        row.put("ok", run.ok());
        row.put("error", run.error());
        row.put("failure_kind", run.failure() == null ? null : run.failure().name());
        HeroItem item = run.item();
        row.put("title", item == null ? null : item.title());
        row.put("url", item == null ? null : item.url());
        row.put("image_url", item == null ? null : item.imageUrl());
        row.put("fingerprint", item == null ? null : item.fingerprint());
        return row;
    }

    private static Map<String, Object> screenshotRow(SourceRun run, UpsertKind kind, String objectPath, String shotUrl) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("ts", run.observedAt().toString());
        row.put("source_id", run.sourceId());
        row.put("run_id", run.runId());
        row.put("kind", screenshotKind(kind));
        row.put("title", run.item().title());
        row.put("url", run.item().url());
        row.put("object_path", objectPath);
        row.put("shot_url", shotUrl);
        return row;
    }

    private static Map<String, Object> itemRow(Top10Snapshot snapshot, RankedItem item) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("run_id", snapshot.snapshotId());
        row.put("source_id", snapshot.sourceId());
        row.put("rank", item.rank());
        row.put("title", item.title());
        row.put("url", item.url());
        row.put("fingerprint", item.fingerprint());
        return row;
    }

    private static Map<String, Object> eventRow(ChangeEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("source_id", event.sourceId());
        row.put("observed_at", event.observedAt().toString());
        row.put("event_type", event.eventType().storageName());
        row.put("fingerprint", event.fingerprint());
        row.put("from_rank", event.fromRank());
        row.put("to_rank", event.toRank());
        row.put("from_title", event.fromTitle());
        row.put("to_title", event.toTitle());
        row.put("from_run_id", event.fromSnapshotId());
        row.put("to_run_id", event.toSnapshotId());
        return row;
    }
}
