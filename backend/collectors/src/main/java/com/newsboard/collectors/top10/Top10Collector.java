package com.newsboard.collectors.top10;

import com.newsboard.collectors.api.Collector;
import com.newsboard.collectors.api.CollectorContext;
import com.newsboard.collectors.api.CollectorResult;
import com.newsboard.collectors.page.PageDriver;
import com.newsboard.collectors.page.PageLoad;
import com.newsboard.collectors.page.PageLoader;
import com.newsboard.collectors.scoring.CandidateScorer;
import com.newsboard.collectors.scoring.ScoreResult;
import com.newsboard.collectors.scoring.ScoredCandidate;
import com.newsboard.collectors.scoring.SourceProfile;
import com.newsboard.core.diff.RankedListDiff;
import com.newsboard.core.events.AlertRaised;
import com.newsboard.core.events.CollectorRunCompleted;
import com.newsboard.core.events.CollectorRunStarted;
import com.newsboard.core.events.RankingChanged;
import com.newsboard.core.events.SourceFetched;
import com.newsboard.core.model.ChangeEvent;
import com.newsboard.core.model.ChangeEventType;
import com.newsboard.core.model.RankedItem;
import com.newsboard.core.model.Top10Snapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

public class Top10Collector implements Collector {
    private static final Logger LOGGER = Logger.getLogger(Top10Collector.class.getName());
    public static final String CONFIG_KEY = "top10Collector";

    private final PageLoader pageLoader;
    private final Supplier<String> snapshotIds;

    public Top10Collector() {
        this(new PageLoader(), () -> UUID.randomUUID().toString());
    }

    public Top10Collector(PageLoader pageLoader, Supplier<String> snapshotIds) {
        this.pageLoader = pageLoader;
        this.snapshotIds = snapshotIds;
    }

    @Override
    public String name() {
        return "top10Collector";
    }

    @Override
    public CollectorResult poll(CollectorContext ctx) {
        Instant startedAt = ctx.clock().instant();
        ctx.eventBus().publish(new CollectorRunStarted(startedAt, name()));

        Top10CollectorConfig cfg = ctx.requiredConfig(CONFIG_KEY, Top10CollectorConfig.class);
        int succeeded = 0;
        int eventCount = 0;
        for (SourceProfile source : cfg.sources()) {
            Top10Snapshot snapshot = observe(source, ctx);
            List<ChangeEvent> events = record(snapshot, ctx);
            if (snapshot.ok()) {
                succeeded++;
            }
            eventCount += events.size();
        }

        Map<String, Object> stats = new HashMap<>();
        stats.put("sources", cfg.sources().size());
        stats.put("successes", succeeded);
        stats.put("events", eventCount);
        boolean success = succeeded == cfg.sources().size();
        ctx.eventBus().publish(new CollectorRunCompleted(
                ctx.clock().instant(),
                name(),
                success,
                Duration.between(startedAt, ctx.clock().instant()).toMillis()
        ));
        String message = "Processed " + cfg.sources().size() + " ranked sources";
        return success
                ? CollectorResult.success(message, stats)
                : CollectorResult.failure(message + " with failures", stats);
    }

    private Top10Snapshot observe(SourceProfile source, CollectorContext ctx) {
        Instant observedAt = ctx.clock().instant();
        String snapshotId = snapshotIds.get();
        Top10Snapshot snapshot;
        try (PageDriver driver = ctx.driverFactory().open()) {
            PageLoad load = pageLoader.load(driver, source, ctx.navigationTimeout(), ctx.waitTimeout());
            if (!load.ok()) {
                snapshot = Top10Snapshot.failed(snapshotId, source.id(), observedAt, load.error());
            } else {
                ScoreResult ranked = new CandidateScorer(source).rank(load.passes(), source.maxItems());
                snapshot = ranked.ok()
                        ? new Top10Snapshot(snapshotId, source.id(), observedAt, true, null, toItems(ranked.ranked()))
                        : Top10Snapshot.failed(snapshotId, source.id(), observedAt, source.name() + ": " + ranked.reason());
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Visit of " + source.id() + " failed", e);
            snapshot = Top10Snapshot.failed(snapshotId, source.id(), observedAt,
                    source.name() + ": " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
        }
        ctx.eventBus().publish(new SourceFetched(
                ctx.clock().instant(),
                source.id(),
                source.homeUrl(),
                snapshot.ok(),
                snapshot.error(),
                Duration.between(observedAt, ctx.clock().instant()).toMillis()
        ));
        return snapshot;
    }

    private List<ChangeEvent> record(Top10Snapshot snapshot, CollectorContext ctx) {
        if (!snapshot.ok()) {
            LOGGER.warning("Top list run for " + snapshot.sourceId() + " failed: " + snapshot.error());
            ctx.eventBus().publish(new AlertRaised(
                    ctx.clock().instant(),
                    "collector",
                    snapshot.error(),
                    Map.of("collector", name(), "sourceId", snapshot.sourceId())
            ));
            ctx.stateStore().putTop10(snapshot);
            ctx.recorder().recordTop10(snapshot, List.of());
            return List.of();
        }

        Top10Snapshot previous = ctx.stateStore().latestTop10(snapshot.sourceId()).orElse(null);
        List<ChangeEvent> events = RankedListDiff.diff(previous, snapshot);
        ctx.stateStore().putTop10(snapshot);
        ctx.stateStore().appendChanges(events);
        ctx.recorder().recordTop10(snapshot, events);

        ctx.eventBus().publish(new RankingChanged(
                ctx.clock().instant(),
                snapshot.sourceId(),
                count(events, ChangeEventType.ENTERED),
                count(events, ChangeEventType.EXITED),
                count(events, ChangeEventType.MOVED),
                count(events, ChangeEventType.TITLE_UPDATED)
        ));
        return events;
    }

    private static List<RankedItem> toItems(List<ScoredCandidate> ranked) {
        List<RankedItem> items = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            ScoredCandidate scored = ranked.get(i);
            items.add(RankedItem.of(i + 1, scored.candidate().title(), scored.candidate().url()));
        }
        return items;
    }

    private static int count(List<ChangeEvent> events, ChangeEventType type) {
        return (int) events.stream().filter(event -> event.eventType() == type).count();
    }
}
