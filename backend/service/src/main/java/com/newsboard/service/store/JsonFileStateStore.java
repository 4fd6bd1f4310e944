package com.newsboard.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsboard.core.history.ResidencyHistory;
import com.newsboard.core.history.UpsertKind;
import com.newsboard.core.model.ChangeEvent;
import com.newsboard.core.model.HeroItem;
import com.newsboard.core.model.ResidencyEntry;
import com.newsboard.core.model.SourceState;
import com.newsboard.core.model.Top10Snapshot;
import com.newsboard.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

public class JsonFileStateStore implements ServiceStateStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    public static final int DEFAULT_TOP10_HISTORY_LIMIT = 48;

    private final Path dataDir;
    private final JsonlChangeEventStore changeEvents;
    private final int top10HistoryLimit;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, SourceState> current = new LinkedHashMap<>();
    private final Map<String, Top10Record> top10 = new LinkedHashMap<>();
    private final List<ChangeEvent> pendingChanges = new ArrayList<>();
    private final ResidencyHistory history;
    private Instant generatedAt;

    public JsonFileStateStore(Path dataDir, JsonlChangeEventStore changeEvents) {
        this(dataDir, changeEvents, DEFAULT_TOP10_HISTORY_LIMIT);
    }

    public JsonFileStateStore(Path dataDir, JsonlChangeEventStore changeEvents, int top10HistoryLimit) {
        this.dataDir = dataDir;
        this.changeEvents = changeEvents;
        this.top10HistoryLimit = Math.max(1, top10HistoryLimit);
        this.history = new ResidencyHistory(loadHistory());
        loadCurrent();
        loadTop10();
    }

    public Path currentFile() {
        return dataDir.resolve("current.json");
    }

    public Path unifiedFile() {
        return dataDir.resolve("unified.json");
    }

    public Path historyFile() {
        return dataDir.resolve("history.json");
    }

    public Path top10File() {
        return dataDir.resolve("top10.json");
    }

    public void registerSource(String sourceId, String name) {
        lock.lock();
        try {
            current.putIfAbsent(sourceId, SourceState.notRefreshed(sourceId, name));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public UpsertKind upsertResidency(String sourceId, Instant observedAt, HeroItem item) {
        return history.upsert(sourceId, observedAt, item);
    }

    @Override
    public Optional<Instant> residencySince(String sourceId, String url) {
        return history.sinceFor(sourceId, url);
    }

    @Override
    public List<ResidencyEntry> residency(String sourceId) {
        return history.entries(sourceId);
    }

    @Override
    public Optional<SourceState> current(String sourceId) {
        lock.lock();
        try {
            return Optional.ofNullable(current.get(sourceId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void putCurrent(SourceState state) {
        lock.lock();
        try {
            current.put(state.sourceId(), state);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Top10Snapshot> latestTop10(String sourceId) {
        lock.lock();
        try {
            Top10Record record = top10.get(sourceId);
            return record == null ? Optional.empty() : Optional.ofNullable(record.lastOk());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void putTop10(Top10Snapshot snapshot) {
        lock.lock();
        try {
            Top10Record previous = top10.get(snapshot.sourceId());
            List<Top10Snapshot> recent = previous == null ? new ArrayList<>() : new ArrayList<>(previous.history());
            recent.add(snapshot);
            while (recent.size() > top10HistoryLimit) {
                recent.remove(0);
            }
            Top10Snapshot lastOk = snapshot.ok() ? snapshot : previous == null ? null : previous.lastOk();
            top10.put(snapshot.sourceId(), new Top10Record(snapshot, lastOk, recent));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void appendChanges(List<ChangeEvent> events) {
        lock.lock();
        try {
            pendingChanges.addAll(events);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, SourceState> currentStates() {
        lock.lock();
        try {
            return new LinkedHashMap<>(current);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, List<ResidencyEntry>> residencyBySource() {
        return history.snapshot();
    }

    @Override
    public List<Top10Snapshot> top10History(String sourceId) {
        lock.lock();
        try {
            Top10Record record = top10.get(sourceId);
            return record == null ? List.of() : List.copyOf(record.history());
        } finally {
            lock.unlock();
        }
    }

    public Optional<Top10Snapshot> newestTop10(String sourceId) {
        lock.lock();
        try {
            Top10Record record = top10.get(sourceId);
            return record == null ? Optional.empty() : Optional.ofNullable(record.latest());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Instant generatedAt() {
        lock.lock();
        try {
            return generatedAt;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int pruneResidency(Instant cutoff) {
        return history.prune(cutoff);
    }

    @Override
    public void flush(Instant generatedAt) {
        lock.lock();
        try {
            changeEvents.append(List.copyOf(pendingChanges));
            pendingChanges.clear();
            Map<String, SourceState> states = new LinkedHashMap<>(current);
            boolean anyOk = states.values().stream().anyMatch(SourceState::ok);
            write(currentFile(), new CurrentFile(anyOk, generatedAt, states, null));
            write(unifiedFile(), new UnifiedFile(anyOk, generatedAt, unifiedItems(states), null));
            write(historyFile(), historyFile(generatedAt));
            write(top10File(), new Top10File(generatedAt, new LinkedHashMap<>(top10)));
            this.generatedAt = generatedAt;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void writeDegraded(Instant generatedAt, String error) {
        lock.lock();
        try {
            writeDegraded(dataDir, generatedAt, error);
        } finally {
            lock.unlock();
        }
    }

    public static void writeDegraded(Path dataDir, Instant generatedAt, String error) {
        write(dataDir.resolve("current.json"), new CurrentFile(false, generatedAt, null, error));
        write(dataDir.resolve("unified.json"), new UnifiedFile(false, generatedAt, List.of(), error));
    }

    private static List<UnifiedItem> unifiedItems(Map<String, SourceState> states) {
        List<UnifiedItem> items = new ArrayList<>();
        for (SourceState state : states.values()) {
            if (!state.ok() || state.item() == null) {
                continue;
            }
            HeroItem item = state.item();
            items.add(new UnifiedItem(
                    state.name(),
                    state.sourceId(),
                    state.updatedAt(),
                    state.since(),
                    item.title(),
                    item.url(),
                    item.imageUrl(),
                    item.fingerprint()
            ));
        }
        return items;
    }

    private HistoryFile historyFile(Instant generatedAt) {
        Map<String, SourceHistory> sources = new LinkedHashMap<>();
        history.snapshot().forEach((sourceId, entries) -> sources.put(sourceId, new SourceHistory(entries)));
        return new HistoryFile(generatedAt, sources);
    }

    private Map<String, List<ResidencyEntry>> loadHistory() {
        HistoryFile loaded = read(historyFile(), HistoryFile.class);
        Map<String, List<ResidencyEntry>> entries = new LinkedHashMap<>();
        if (loaded != null && loaded.sources() != null) {
            loaded.sources().forEach((sourceId, source) ->
                    entries.put(sourceId, source.entries() == null ? List.of() : source.entries()));
        }
        return entries;
    }

    private void loadCurrent() {
        CurrentFile loaded = read(currentFile(), CurrentFile.class);
        if (loaded == null) {
            return;
        }
        generatedAt = loaded.generatedAt();
        if (loaded.sources() != null) {
            current.putAll(loaded.sources());
        }
    }

    private void loadTop10() {
        Top10File loaded = read(top10File(), Top10File.class);
        if (loaded != null && loaded.sources() != null) {
            loaded.sources().forEach((sourceId, record) -> top10.put(sourceId, new Top10Record(
                    record.latest(),
                    record.lastOk(),
                    record.history() == null ? List.of() : record.history()
            )));
        }
    }

    private <T> T read(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return null;
        }
        try (InputStream in = Files.newInputStream(file)) {
            return MAPPER.readValue(in, type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading state from " + file, e);
        }
    }

    private static void write(Path file, Object value) {
        try {
            Files.createDirectories(file.getParent());
            try (OutputStream out = Files.newOutputStream(file)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, value);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing state to " + file, e);
        }
    }

    record CurrentFile(boolean ok, Instant generatedAt, Map<String, SourceState> sources, String error) {
    }

    record UnifiedFile(boolean ok, Instant generatedAt, List<UnifiedItem> items, String error) {
    }

    record UnifiedItem(
            String source,
            String sourceId,
            Instant updatedAt,
            Instant since,
            String title,
            String url,
            String imageUrl,
            String fingerprint
    ) {
    }

    record HistoryFile(Instant generatedAt, Map<String, SourceHistory> sources) {
    }

    record SourceHistory(List<ResidencyEntry> entries) {
    }

    record Top10File(Instant generatedAt, Map<String, Top10Record> sources) {
    }

    record Top10Record(Top10Snapshot latest, Top10Snapshot lastOk, List<Top10Snapshot> history) {
    }
}
