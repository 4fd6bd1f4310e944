package com.newsboard.collectors.hero;

import com.newsboard.collectors.api.Collector;
import com.newsboard.collectors.api.CollectorContext;
import com.newsboard.collectors.api.CollectorResult;
import com.newsboard.collectors.api.Screenshot;
import com.newsboard.collectors.archive.RunArchive;
import com.newsboard.collectors.overlay.DismissalReport;
import com.newsboard.collectors.overlay.OverlayDismisser;
import com.newsboard.collectors.page.PageDriver;
import com.newsboard.collectors.page.PageLoad;
import com.newsboard.collectors.page.PageLoader;
import com.newsboard.collectors.page.ScreenshotRequest;
import com.newsboard.collectors.scoring.CandidateScorer;
import com.newsboard.collectors.scoring.ScoreResult;
import com.newsboard.collectors.scoring.SourceProfile;
import com.newsboard.core.events.AlertRaised;
import com.newsboard.core.events.CollectorRunCompleted;
import com.newsboard.core.events.CollectorRunStarted;
import com.newsboard.core.events.HeroChanged;
import com.newsboard.core.events.SourceFetched;
import com.newsboard.core.history.UpsertKind;
import com.newsboard.core.model.FailureKind;
import com.newsboard.core.model.HeroItem;
import com.newsboard.core.model.ResidencyEntry;
import com.newsboard.core.model.SourceRun;
import com.newsboard.core.model.SourceState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

public class HeroCollector implements Collector {
    private static final Logger LOGGER = Logger.getLogger(HeroCollector.class.getName());
    public static final String CONFIG_KEY = "heroCollector";

    private final PageLoader pageLoader;
    private final OverlayDismisser overlayDismisser;
    private final Supplier<String> runIds;
    private final RunArchive archive;

    public HeroCollector() {
        this(RunArchive.NONE);
    }

    public HeroCollector(RunArchive archive) {
        this(new PageLoader(), new OverlayDismisser(), () -> UUID.randomUUID().toString(), archive);
    }

    public HeroCollector(PageLoader pageLoader, OverlayDismisser overlayDismisser, Supplier<String> runIds) {
        this(pageLoader, overlayDismisser, runIds, RunArchive.NONE);
    }

    public HeroCollector(
            PageLoader pageLoader,
            OverlayDismisser overlayDismisser,
            Supplier<String> runIds,
            RunArchive archive
    ) {
        this.pageLoader = pageLoader;
        this.overlayDismisser = overlayDismisser;
        this.runIds = runIds;
        this.archive = archive;
    }

    @Override
    public String name() {
        return "heroCollector";
    }

    @Override
    public CollectorResult poll(CollectorContext ctx) {
        Instant startedAt = ctx.clock().instant();
        ctx.eventBus().publish(new CollectorRunStarted(startedAt, name()));

        HeroCollectorConfig cfg = ctx.requiredConfig(CONFIG_KEY, HeroCollectorConfig.class);
        List<SourceOutcome> outcomes = new ArrayList<>();
        for (SourceProfile source : cfg.sources()) {
            try {
                outcomes.add(pollSource(source, cfg.screenshots(), ctx));
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Hero run for " + source.id() + " aborted", e);
                ctx.eventBus().publish(new AlertRaised(
                        ctx.clock().instant(),
                        "collector",
                        source.name() + ": " + e.getMessage(),
                        Map.of("collector", name(), "sourceId", source.id())
                ));
                outcomes.add(new SourceOutcome(false, false, 0));
            }
        }

        CollectorResult result = summarize(outcomes);
        ctx.eventBus().publish(new CollectorRunCompleted(
                ctx.clock().instant(),
                name(),
                result.success(),
                Duration.between(startedAt, ctx.clock().instant()).toMillis()
        ));
        return result;
    }

    private SourceOutcome pollSource(SourceProfile source, ScreenshotSettings screenshots, CollectorContext ctx) {
        Instant observedAt = ctx.clock().instant();
        String runId = runIds.get();
        SourceRun run;
        Optional<Screenshot> screenshot = Optional.empty();
        String html = null;

        try (PageDriver driver = ctx.driverFactory().open()) {
            PageLoad load = pageLoader.load(driver, source, ctx.navigationTimeout(), ctx.waitTimeout());
            if (!load.ok()) {
                run = SourceRun.failure(runId, source.id(), observedAt, load.failure(), load.error());
            } else {
                html = pageHtml(driver, source);
                ScoreResult scored = new CandidateScorer(source).select(load.passes());
                run = scored.winner()
                        .map(winner -> SourceRun.success(runId, source.id(), observedAt, HeroItem.from(winner.candidate())))
                        .orElseGet(() -> SourceRun.failure(runId, source.id(), observedAt, FailureKind.EXTRACTION,
                                source.name() + ": " + scored.reason()));
                if (run.ok() && screenshots.enabled()) {
                    screenshot = capture(driver, source, screenshots);
                }
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Visit of " + source.id() + " failed", e);
            run = SourceRun.failure(runId, source.id(), observedAt, FailureKind.NAVIGATION,
                    source.name() + ": " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
        }
        archive.archive(run, html);

        long durationMillis = Duration.between(observedAt, ctx.clock().instant()).toMillis();
        ctx.eventBus().publish(new SourceFetched(
                ctx.clock().instant(),
                source.id(),
                source.homeUrl(),
                run.ok(),
                run.failure() == null ? null : run.failure().name(),
                durationMillis
        ));

        Optional<ResidencyEntry> before = lastEntry(ctx, source.id());
        UpsertKind kind = ctx.stateStore().upsertResidency(source.id(), observedAt, run.item());
        Instant since = run.ok() ? ctx.stateStore().residencySince(source.id(), run.item().url()).orElse(null) : null;
        ctx.stateStore().putCurrent(SourceState.fromRun(source.name(), run, since));

        boolean changed = before.isPresent() && (kind == UpsertKind.NEW_URL || kind == UpsertKind.NEW_TITLE);
        if (changed) {
            ctx.eventBus().publish(new HeroChanged(
                    ctx.clock().instant(),
                    source.id(),
                    before.get().url(),
                    run.item().url(),
                    run.item().title(),
                    kind == UpsertKind.NEW_TITLE
            ));
        }
        if (!run.ok()) {
            LOGGER.warning("Hero run for " + source.id() + " failed: " + run.error());
            ctx.eventBus().publish(new AlertRaised(
                    ctx.clock().instant(),
                    "collector",
                    run.error(),
                    Map.of("collector", name(), "sourceId", source.id(), "failure", run.failure().name())
            ));
        }

        ctx.recorder().recordHero(run, kind, screenshot);
        return new SourceOutcome(run.ok(), changed, durationMillis);
    }

    // Sticky modals can show up on scroll, so a scrolled capture is cleaned twice.
    private Optional<Screenshot> capture(PageDriver driver, SourceProfile source, ScreenshotSettings settings) {
        ScreenshotRequest request = settings.toRequest();
        try {
            dismissOverlays(driver, source, settings);
            if (request.scrollY() > 0) {
                driver.scrollTo(request.scrollY());
            }
            driver.settle(request.settle());
            if (request.scrollY() > 0) {
                dismissOverlays(driver, source, settings);
            }
            return driver.screenshot(request);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Screenshot of " + source.id() + " failed, recording run without it", e);
            return Optional.empty();
        }
    }

    private void dismissOverlays(PageDriver driver, SourceProfile source, ScreenshotSettings settings) {
        if (!settings.dismissOverlays()) {
            return;
        }
        driver.overlays().ifPresent(page -> {
            DismissalReport report = overlayDismisser.dismiss(page);
            LOGGER.fine("Overlay cleanup on " + source.id() + ": " + report.steps());
        });
    }

    private static String pageHtml(PageDriver driver, SourceProfile source) {
        try {
            return driver.evaluate(document -> document.outerHtml());
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "No page html to archive for " + source.id(), e);
            return null;
        }
    }

    private static Optional<ResidencyEntry> lastEntry(CollectorContext ctx, String sourceId) {
        List<ResidencyEntry> entries = ctx.stateStore().residency(sourceId);
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    private CollectorResult summarize(List<SourceOutcome> outcomes) {
        long successCount = outcomes.stream().filter(SourceOutcome::success).count();
        long changedCount = outcomes.stream().filter(SourceOutcome::changed).count();
        double avgDuration = outcomes.stream().mapToLong(SourceOutcome::durationMillis).average().orElse(0);

        Map<String, Object> stats = new HashMap<>();
        stats.put("sources", outcomes.size());
        stats.put("successes", successCount);
        stats.put("changes", changedCount);
        stats.put("avgDurationMillis", avgDuration);

        if (successCount == outcomes.size()) {
            return CollectorResult.success("Processed " + outcomes.size() + " sources", stats);
        }
        return CollectorResult.failure("Processed " + outcomes.size() + " sources with failures", stats);
    }

    private record SourceOutcome(boolean success, boolean changed, long durationMillis) {
    }
}
