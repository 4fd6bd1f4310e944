package com.newsboard.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsboard.core.history.UpsertKind;
import com.newsboard.core.model.ChangeEvent;
import com.newsboard.core.model.ChangeEventType;
import com.newsboard.core.model.HeroItem;
import com.newsboard.core.model.RankedItem;
import com.newsboard.core.model.SourceRun;
import com.newsboard.core.model.SourceState;
import com.newsboard.core.model.Top10Snapshot;
import com.newsboard.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileStateStoreTest {
    private static final Instant T0 = Instant.parse("2026-03-04T10:00:00Z");
    private static final HeroItem STORM = HeroItem.of("Storm hits the coast as evacuations widen",
            "https://www.cbsnews.com/news/storm-hits-coast/", "https://www.cbsnews.com/img/storm.jpg");

    @Test
    void registeredSourcesAppearAsNotRefreshedAndCurrentIsNotOk() throws Exception {
        Path dir = Files.createTempDirectory("state-store-");
        JsonFileStateStore store = newStore(dir);
        store.registerSource("cbs1", "CBS News");

        store.flush(T0);

        JsonNode current = read(store.currentFile());
        assertFalse(current.get("ok").asBoolean());
        assertEquals("Not refreshed yet", current.get("sources").get("cbs1").get("error").asText());
        assertEquals(0, read(store.unifiedFile()).get("items").size());
        assertEquals(T0, store.generatedAt());
    }

    @Test
    void successfulSourceIsWrittenToCurrentAndUnified() throws Exception {
        Path dir = Files.createTempDirectory("state-store-ok-");
        JsonFileStateStore store = newStore(dir);
        store.registerSource("cbs1", "CBS News");
        store.registerSource("abc1", "ABC News");
        store.upsertResidency("cbs1", T0, STORM);
        SourceRun run = SourceRun.success("run-1", "cbs1", T0, STORM);
        store.putCurrent(SourceState.fromRun("CBS News", run, store.residencySince("cbs1", STORM.url()).orElse(null)));

        store.flush(T0.plusSeconds(5));

        JsonNode current = read(store.currentFile());
        assertTrue(current.get("ok").asBoolean());
        assertEquals("run-1", current.get("sources").get("cbs1").get("runId").asText());
        JsonNode items = read(store.unifiedFile()).get("items");
        assertEquals(1, items.size());
        assertEquals("CBS News", items.get(0).get("source").asText());
        assertEquals(STORM.fingerprint(), items.get(0).get("fingerprint").asText());
        assertEquals(T0.toString(), items.get(0).get("since").asText());
    }

    @Test
    void stateSurvivesAReload() throws Exception {
        Path dir = Files.createTempDirectory("state-store-reload-");
        JsonFileStateStore store = newStore(dir);
        store.registerSource("cbs1", "CBS News");
        store.upsertResidency("cbs1", T0, STORM);
        store.upsertResidency("cbs1", T0.plusSeconds(600), STORM);
        store.putCurrent(SourceState.fromRun("CBS News", SourceRun.success("run-2", "cbs1", T0.plusSeconds(600), STORM), T0));
        store.putTop10(snapshot("s-1", T0, true));
        store.flush(T0.plusSeconds(600));

        JsonFileStateStore reloaded = newStore(dir);

        assertEquals(1, reloaded.residency("cbs1").size());
        assertEquals(2, reloaded.residency("cbs1").get(0).seenCount());
        assertEquals("run-2", reloaded.current("cbs1").orElseThrow().runId());
        assertEquals("s-1", reloaded.latestTop10("bbc1").orElseThrow().snapshotId());
        assertEquals(UpsertKind.EXTENDED, reloaded.upsertResidency("cbs1", T0.plusSeconds(1200), STORM));
    }

    @Test
    void failedSnapshotDoesNotReplaceTheLastSuccessfulOne() throws Exception {
        Path dir = Files.createTempDirectory("state-store-top10-");
        JsonFileStateStore store = new JsonFileStateStore(dir, new JsonlChangeEventStore(dir.resolve("events.jsonl")), 2);

        store.putTop10(snapshot("s-1", T0, true));
        store.putTop10(snapshot("s-2", T0.plusSeconds(60), true));
        store.putTop10(Top10Snapshot.failed("s-3", "bbc1", T0.plusSeconds(120), "BBC: navigation timed out"));

        assertEquals("s-2", store.latestTop10("bbc1").orElseThrow().snapshotId());
        assertEquals("s-3", store.newestTop10("bbc1").orElseThrow().snapshotId());
        assertEquals(List.of("s-2", "s-3"), store.top10History("bbc1").stream().map(Top10Snapshot::snapshotId).toList());
        assertTrue(store.latestTop10("unknown").isEmpty());
    }

    @Test
    void changeEventsAreAppendedOnFlush() throws Exception {
        Path dir = Files.createTempDirectory("state-store-changes-");
        JsonlChangeEventStore events = new JsonlChangeEventStore(dir.resolve("change-events.jsonl"));
        JsonFileStateStore store = new JsonFileStateStore(dir, events);

        store.appendChanges(List.of(new ChangeEvent("bbc1", T0, ChangeEventType.ENTERED, "f1",
                null, 1, null, "First", null, "s-1")));
        assertFalse(Files.exists(events.file()));

        store.flush(T0);

        assertEquals(1, events.query(Optional.empty(), Instant.EPOCH, 10).size());
        store.flush(T0.plusSeconds(1));
        assertEquals(1, events.query(Optional.empty(), Instant.EPOCH, 10).size());
    }

    @Test
    void corruptStateFileFailsWithItsPath() throws Exception {
        Path dir = Files.createTempDirectory("state-store-corrupt-");
        Files.writeString(dir.resolve("current.json"), "{broken");

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> newStore(dir));

        assertTrue(error.getMessage().contains("current.json"));
    }

    @Test
    void degradedArtifactsCarryTheError() throws Exception {
        Path dir = Files.createTempDirectory("state-store-degraded-");

        JsonFileStateStore.writeDegraded(dir, T0, "Failed loading state from history.json");

        JsonNode current = read(dir.resolve("current.json"));
        JsonNode unified = read(dir.resolve("unified.json"));
        assertFalse(current.get("ok").asBoolean());
        assertEquals("Failed loading state from history.json", current.get("error").asText());
        assertFalse(unified.get("ok").asBoolean());
        assertEquals(0, unified.get("items").size());
    }

    @Test
    void pruneResidencyDropsStaleEntries() throws Exception {
        Path dir = Files.createTempDirectory("state-store-prune-");
        JsonFileStateStore store = newStore(dir);
        store.upsertResidency("cbs1", T0, STORM);
        HeroItem next = HeroItem.of("Markets rally after a quiet week of trading",
                "https://www.cbsnews.com/news/markets-rally/", null);
        store.upsertResidency("cbs1", T0.plusSeconds(86_400L * 40), next);

        int removed = store.pruneResidency(T0.plusSeconds(86_400L * 10));

        assertEquals(1, removed);
        assertEquals(next.url(), store.residency("cbs1").get(0).url());
    }

    private static JsonFileStateStore newStore(Path dir) {
        return new JsonFileStateStore(dir, new JsonlChangeEventStore(dir.resolve("change-events.jsonl")));
    }

    private static Top10Snapshot snapshot(String id, Instant at, boolean ok) {
        return new Top10Snapshot(id, "bbc1", at, ok, null, List.of(
                RankedItem.of(1, "First most read story of the day", "https://www.bbc.com/news/articles/a"),
                RankedItem.of(2, "Second most read story of the day", "https://www.bbc.com/news/articles/b")
        ));
    }

    private static JsonNode read(Path file) throws Exception {
        return JsonUtils.objectMapper().readTree(Files.readString(file));
    }
}
