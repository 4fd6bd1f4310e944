package com.newsboard.service.runtime;

import com.newsboard.collectors.api.Collector;
import com.newsboard.collectors.api.CollectorContext;
import com.newsboard.collectors.api.CollectorResult;
import com.newsboard.collectors.hero.HeroCollector;
import com.newsboard.collectors.hero.HeroCollectorConfig;
import com.newsboard.collectors.top10.Top10Collector;
import com.newsboard.collectors.top10.Top10CollectorConfig;
import com.newsboard.core.events.AlertRaised;
import com.newsboard.service.publish.RemoteRunRecorder;
import com.newsboard.service.remote.RemoteSnapshotLoader;
import com.newsboard.service.retention.RetentionPruner;
import com.newsboard.service.retention.RetentionReport;
import com.newsboard.service.store.ServiceStateStore;
import com.newsboard.service.write.BatchOutcome;
import com.newsboard.service.write.RetryingWriter;
import com.newsboard.service.write.WriteFailedException;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

public class RunOrchestrator {
    private static final Logger LOGGER = Logger.getLogger(RunOrchestrator.class.getName());

    private final List<Collector> collectors;
    private final CollectorContext context;
    private final ServiceStateStore stateStore;
    private final RemoteRunRecorder recorder;
    private final RetentionPruner pruner;
    private final RemoteSnapshotLoader snapshotLoader;
    private final RetryingWriter writer;

    public RunOrchestrator(List<Collector> collectors, CollectorContext context, ServiceStateStore stateStore) {
        this(collectors, context, stateStore, null, null, null, null);
    }

    public RunOrchestrator(
            List<Collector> collectors,
            CollectorContext context,
            ServiceStateStore stateStore,
            RemoteRunRecorder recorder,
            RetentionPruner pruner,
            RemoteSnapshotLoader snapshotLoader,
            RetryingWriter writer
    ) {
        this.collectors = List.copyOf(collectors);
        this.context = context;
        this.stateStore = stateStore;
        this.recorder = recorder;
        this.pruner = pruner;
        this.snapshotLoader = snapshotLoader;
        this.writer = writer;
    }

    public Set<String> sourceIds() {
        Set<String> ids = new LinkedHashSet<>();
        heroConfig().ifPresent(cfg -> ids.addAll(cfg.sourceIds()));
        top10Config().ifPresent(cfg -> ids.addAll(cfg.sourceIds()));
        return ids;
    }

    public synchronized RunReport runOnce(Optional<String> sourceId) {
        if (sourceId.isPresent() && !sourceIds().contains(sourceId.get())) {
            throw new IllegalArgumentException("Unknown source: " + sourceId.get());
        }
        Instant startedAt = context.clock().instant();
        CollectorContext runContext = contextFor(sourceId);
        seedTop10(runContext);

        Map<String, CollectorResult> results = new LinkedHashMap<>();
        for (Collector collector : collectors) {
            if (!hasSources(collector, runContext)) {
                continue;
            }
            results.put(collector.name(), runCollectorSafely(collector, runContext));
        }

        BatchOutcome batch = recorder == null ? BatchOutcome.EMPTY : recorder.flush();
        RetentionReport retention;
        Instant finishedAt;
        try {
            retention = pruner == null ? null : pruner.prune();
            finishedAt = context.clock().instant();
            stateStore.flush(finishedAt);
        } catch (IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "Writing run state failed, leaving degraded artifacts", e);
            try {
                stateStore.writeDegraded(context.clock().instant(), e.getMessage());
            } catch (IllegalStateException degraded) {
                e.addSuppressed(degraded);
            }
            throw e;
        }
        RunReport report = new RunReport(startedAt, finishedAt, results, batch, retention);
        LOGGER.info("Run finished in " + Duration.between(startedAt, finishedAt).toMillis()
                + "ms, success=" + report.success());
        return report;
    }

    private CollectorResult runCollectorSafely(Collector collector, CollectorContext runContext) {
        try {
            return collector.poll(runContext);
        } catch (Exception ex) {
            LOGGER.log(Level.WARNING, "Collector " + collector.name() + " failed", ex);
            runContext.eventBus().publish(new AlertRaised(
                    runContext.clock().instant(),
                    "collector",
                    "Collector run failed: " + collector.name() + " - " + ex.getMessage(),
                    Map.of("collector", collector.name())
            ));
            return CollectorResult.failure(
                    "Collector run failed: " + collector.name(),
                    Map.of("collector", collector.name())
            );
        }
    }

    private void seedTop10(CollectorContext runContext) {
        if (snapshotLoader == null) {
            return;
        }
        Object cfg = runContext.config().get(Top10Collector.CONFIG_KEY);
        if (!(cfg instanceof Top10CollectorConfig top10)) {
            return;
        }
        for (String id : top10.sourceIds()) {
            if (stateStore.latestTop10(id).isPresent()) {
                continue;
            }
            try {
                writer.execute("load top10 " + id, () -> snapshotLoader.latest(id)).ifPresent(snapshot -> {
                    LOGGER.info("Seeded " + id + " with remote snapshot " + snapshot.snapshotId());
                    stateStore.putTop10(snapshot);
                });
            } catch (WriteFailedException e) {
                LOGGER.warning("No remote snapshot for " + id + ": " + e.diagnostic());
            }
        }
    }

    private CollectorContext contextFor(Optional<String> sourceId) {
        if (sourceId.isEmpty()) {
            return context;
        }
        Map<String, Object> config = new HashMap<>(context.config());
        heroConfig().ifPresent(cfg -> config.put(HeroCollector.CONFIG_KEY, cfg.only(sourceId.get())));
        top10Config().ifPresent(cfg -> config.put(Top10Collector.CONFIG_KEY, cfg.only(sourceId.get())));
        return new CollectorContext(
                context.driverFactory(),
                context.eventBus(),
                context.stateStore(),
                context.recorder(),
                context.clock(),
                context.navigationTimeout(),
                context.waitTimeout(),
                config
        );
    }

    private static boolean hasSources(Collector collector, CollectorContext runContext) {
        Object cfg = runContext.config().get(collector.name());
        if (cfg instanceof HeroCollectorConfig hero) {
            return !hero.sources().isEmpty();
        }
        if (cfg instanceof Top10CollectorConfig top10) {
            return !top10.sources().isEmpty();
        }
        return true;
    }

    private Optional<HeroCollectorConfig> heroConfig() {
        Object cfg = context.config().get(HeroCollector.CONFIG_KEY);
        return cfg instanceof HeroCollectorConfig hero ? Optional.of(hero) : Optional.empty();
    }

    private Optional<Top10CollectorConfig> top10Config() {
        Object cfg = context.config().get(Top10Collector.CONFIG_KEY);
        return cfg instanceof Top10CollectorConfig top10 ? Optional.of(top10) : Optional.empty();
    }
}
