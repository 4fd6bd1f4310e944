package com.newsboard.service.retention;

import com.newsboard.service.remote.Filter;
import com.newsboard.service.remote.ObjectStore;
import com.newsboard.service.remote.Order;
import com.newsboard.service.remote.RemoteTables;
import com.newsboard.service.remote.RowStore;
import com.newsboard.service.store.JsonlChangeEventStore;
import com.newsboard.service.store.ServiceStateStore;
import com.newsboard.service.write.RetryingWriter;
import com.newsboard.service.write.WriteFailedException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

public class RetentionPruner {
    private static final Logger LOGGER = Logger.getLogger(RetentionPruner.class.getName());

    private final RetentionPolicy policy;
    private final ServiceStateStore stateStore;
    private final JsonlChangeEventStore changeEvents;
    private final RowStore rowStore;
    private final ObjectStore objectStore;
    private final RetryingWriter writer;
    private final Clock clock;

    public RetentionPruner(
            RetentionPolicy policy,
            ServiceStateStore stateStore,
            JsonlChangeEventStore changeEvents,
            RowStore rowStore,
            ObjectStore objectStore,
            RetryingWriter writer,
            Clock clock
    ) {
        this.policy = policy;
        this.stateStore = stateStore;
        this.changeEvents = changeEvents;
        this.rowStore = rowStore;
        this.objectStore = objectStore;
        this.writer = writer;
        this.clock = clock;
    }

    public RetentionReport prune() {
        Instant now = clock.instant();
        Map<String, String> failures = new LinkedHashMap<>();
        int residencyRemoved = pruneLocal("prune residency", failures,
                () -> stateStore.pruneResidency(now.minus(policy.historyMaxAge())));
        int eventsRemoved = pruneLocal("prune change_events", failures,
                () -> changeEvents.prune(now.minus(policy.eventMaxAge())));
        ScreenshotTally screenshots = new ScreenshotTally();
        if (rowStore != null) {
            pruneScreenshots(now.minus(policy.screenshotMaxAge()), screenshots, failures);
        }
        if (residencyRemoved + eventsRemoved + screenshots.rows > 0) {
            LOGGER.info("Retention removed " + residencyRemoved + " residency entries, " + eventsRemoved
                    + " change events, " + screenshots.rows + " screenshot events");
        }
        return new RetentionReport(residencyRemoved, eventsRemoved, screenshots.rows, screenshots.objects, failures);
    }

    private static int pruneLocal(String label, Map<String, String> failures, IntSupplier step) {
        try {
            return step.getAsInt();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, label + " failed", e);
            failures.put(label, String.valueOf(e.getMessage()));
            return 0;
        }
    }

    private void pruneScreenshots(Instant cutoff, ScreenshotTally removed, Map<String, String> failures) {
        int page = 0;
        while (true) {
            page++;
            String pageLabel = "prune screenshot_events page " + page;
            try {
                List<Map<String, Object>> rows = writer.execute(pageLabel + " query", () -> rowStore.query(
                        RemoteTables.SCREENSHOT_EVENTS,
                        List.of(Filter.lt("ts", cutoff.toString())),
                        Order.asc("ts"),
                        policy.pageSize()
                ));
                if (rows.isEmpty()) {
                    return;
                }
                List<String> ids = new ArrayList<>();
                List<String> paths = new ArrayList<>();
                for (Map<String, Object> row : rows) {
                    ids.add(String.valueOf(row.get("id")));
                    Object path = row.get("object_path");
                    if (path != null) {
                        paths.add(String.valueOf(path));
                    }
                }
                if (objectStore != null && !paths.isEmpty()) {
                    writer.run(pageLabel + " objects", () -> objectStore.delete(paths));
                    removed.objects += paths.size();
                }
                writer.run(pageLabel + " rows", () -> rowStore.delete(RemoteTables.SCREENSHOT_EVENTS, ids));
                removed.rows += ids.size();
                if (rows.size() < policy.pageSize()) {
                    return;
                }
            } catch (WriteFailedException e) {
                LOGGER.warning("Screenshot retention stopped: " + e.getMessage());
                failures.put(e.label(), e.diagnostic());
                return;
            }
        }
    }

    private static final class ScreenshotTally {
        private int rows;
        private int objects;
    }
}
