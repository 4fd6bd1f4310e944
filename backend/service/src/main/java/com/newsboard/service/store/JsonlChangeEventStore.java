package com.newsboard.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsboard.core.model.ChangeEvent;
import com.newsboard.core.util.JsonUtils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

public class JsonlChangeEventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlChangeEventStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlChangeEventStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public void append(List<ChangeEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            createParent();
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                for (ChangeEvent event : events) {
                    writer.write(MAPPER.writeValueAsString(event));
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending change events to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Events observed at or after {@code since}, oldest first, keeping only the newest {@code limit}.
     */
    public List<ChangeEvent> query(Optional<String> sourceId, Instant since, int limit) {
        lock.lock();
        try {
            List<ChangeEvent> events = new ArrayList<>();
            for (ChangeEvent event : readAll(false)) {
                if (event.observedAt().isBefore(since)) {
                    continue;
                }
                if (sourceId.isPresent() && !sourceId.get().equals(event.sourceId())) {
                    continue;
                }
                events.add(event);
            }
            if (events.size() <= limit) {
                return events;
            }
            return List.copyOf(events.subList(events.size() - limit, events.size()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rewrites the log without events observed before {@code cutoff} and without undecodable lines.
     * Returns how many lines were dropped.
     */
    public int prune(Instant cutoff) {
        lock.lock();
        try {
            List<ChangeEvent> all = new ArrayList<>();
            int undecodable = readAll(true, all);
            List<ChangeEvent> kept = all.stream().filter(event -> !event.observedAt().isBefore(cutoff)).toList();
            int removed = all.size() - kept.size() + undecodable;
            if (removed == 0) {
                return 0;
            }
            createParent();
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                for (ChangeEvent event : kept) {
                    writer.write(MAPPER.writeValueAsString(event));
                    writer.newLine();
                }
            }
            return removed;
        } catch (IOException e) {
            throw new IllegalStateException("Failed pruning change events in " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private List<ChangeEvent> readAll(boolean skipUndecodable) {
        List<ChangeEvent> events = new ArrayList<>();
        readAll(skipUndecodable, events);
        return events;
    }

    private int readAll(boolean skipUndecodable, List<ChangeEvent> events) {
        if (!Files.exists(file)) {
            return 0;
        }
        int lineNumber = 0;
        int skipped = 0;
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    events.add(MAPPER.readValue(line, ChangeEvent.class));
                } catch (IOException | RuntimeException decodeError) {
                    if (!skipUndecodable) {
                        throw new IllegalStateException("Invalid JSONL event at line " + lineNumber + " of " + file, decodeError);
                    }
                    LOGGER.warning("Dropping undecodable event at line " + lineNumber + " of " + file);
                    skipped++;
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading change events from " + file, e);
        }
        return skipped;
    }

    private void createParent() throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
    }
}
