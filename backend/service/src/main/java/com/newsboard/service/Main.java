package com.newsboard.service;

import com.newsboard.collectors.api.Collector;
import com.newsboard.collectors.api.CollectorContext;
import com.newsboard.collectors.api.RunRecorder;
import com.newsboard.collectors.archive.DirectoryRunArchive;
import com.newsboard.collectors.hero.HeroCollector;
import com.newsboard.collectors.hero.HeroCollectorConfig;
import com.newsboard.collectors.page.JsoupPageDriverFactory;
import com.newsboard.collectors.page.PageDriverFactory;
import com.newsboard.collectors.scoring.SourceProfile;
import com.newsboard.collectors.top10.Top10Collector;
import com.newsboard.collectors.top10.Top10CollectorConfig;
import com.newsboard.core.bus.EventBus;
import com.newsboard.core.events.AlertRaised;
import com.newsboard.core.events.HeroChanged;
import com.newsboard.core.events.RankingChanged;
import com.newsboard.service.api.ApiServer;
import com.newsboard.service.browser.PlaywrightDriverFactory;
import com.newsboard.service.config.ConfigLoader;
import com.newsboard.service.config.PipelineConfig;
import com.newsboard.service.http.HttpClientFactory;
import com.newsboard.service.publish.RemoteRunRecorder;
import com.newsboard.service.remote.RemoteSnapshotLoader;
import com.newsboard.service.remote.SupabaseObjectStore;
import com.newsboard.service.remote.SupabaseRowStore;
import com.newsboard.service.retention.RetentionPruner;
import com.newsboard.service.runtime.RunOrchestrator;
import com.newsboard.service.runtime.RunReport;
import com.newsboard.service.store.JsonFileStateStore;
import com.newsboard.service.store.JsonlChangeEventStore;
import com.newsboard.service.write.RetryingWriter;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        Map<String, String> env = System.getenv();

        Path configDir = Path.of("config");
        HeroCollectorConfig heroConfig = ConfigLoader.loadHeroes(configDir);
        Top10CollectorConfig top10Config = ConfigLoader.loadTop10(configDir);
        PipelineConfig pipeline = ConfigLoader.loadPipeline(configDir);
        Path dataDir = Path.of(pipeline.dataDir());
        Clock clock = Clock.systemUTC();

        EventBus eventBus = new EventBus();
        eventBus.subscribe(AlertRaised.class, alert -> LOGGER.warning("Alert: " + alert.message()));
        eventBus.subscribe(HeroChanged.class, changed -> LOGGER.info("Lead story of " + changed.sourceId()
                + (changed.headlineOnly() ? " retitled: " : " changed: ") + changed.title()));
        eventBus.subscribe(RankingChanged.class, changed -> LOGGER.info("Ranking of " + changed.sourceId()
                + ": +" + changed.entered() + " -" + changed.exited() + " ~" + changed.moved()));

        JsonlChangeEventStore changeEvents = new JsonlChangeEventStore(dataDir.resolve("change-events.jsonl"));
        JsonFileStateStore stateStore;
        try {
            stateStore = new JsonFileStateStore(dataDir, changeEvents, pipeline.top10HistoryLimit());
        } catch (IllegalStateException e) {
            JsonFileStateStore.writeDegraded(dataDir, clock.instant(), e.getMessage());
            throw e;
        }
        for (SourceProfile source : heroConfig.sources()) {
            stateStore.registerSource(source.id(), source.name());
        }

        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(10));
        RetryingWriter writer = new RetryingWriter(pipeline.write());
        String supabaseUrl = env.getOrDefault("SUPABASE_URL", "");
        String supabaseKey = env.getOrDefault("SUPABASE_SERVICE_ROLE_KEY", "");
        SupabaseRowStore rowStore = null;
        SupabaseObjectStore objectStore = null;
        RemoteRunRecorder remoteRecorder = null;
        if (!supabaseUrl.isBlank() && !supabaseKey.isBlank()) {
            rowStore = new SupabaseRowStore(httpClient, supabaseUrl, supabaseKey, pipeline.storeTimeout());
            objectStore = new SupabaseObjectStore(httpClient, supabaseUrl, supabaseKey,
                    env.getOrDefault("SUPABASE_SCREENSHOT_BUCKET", "screenshots"), pipeline.storeTimeout());
            remoteRecorder = new RemoteRunRecorder(rowStore, objectStore, writer, pipeline.objectPrefix(), pipeline.signedUrlTtl());
        } else {
            LOGGER.info("SUPABASE_URL / SUPABASE_SERVICE_ROLE_KEY not set; keeping results local only.");
        }

        boolean useBrowser = !"http".equalsIgnoreCase(env.getOrDefault("NEWSBOARD_DRIVER", "playwright"));
        PlaywrightDriverFactory browser = useBrowser ? PlaywrightDriverFactory.launch() : null;
        PageDriverFactory driverFactory = browser != null ? browser : new JsoupPageDriverFactory(httpClient);

        CollectorContext context = new CollectorContext(
                driverFactory,
                eventBus,
                stateStore,
                remoteRecorder != null ? remoteRecorder : RunRecorder.NOOP,
                clock,
                pipeline.navigationTimeout(),
                pipeline.waitTimeout(),
                Map.of(
                        HeroCollector.CONFIG_KEY, heroConfig,
                        Top10Collector.CONFIG_KEY, top10Config
                )
        );
        List<Collector> collectors = List.of(
                new HeroCollector(new DirectoryRunArchive(Path.of(pipeline.archiveDir()))),
                new Top10Collector()
        );
        RetentionPruner pruner = new RetentionPruner(
                pipeline.retention(), stateStore, changeEvents, rowStore, objectStore, writer, clock);
        RunOrchestrator orchestrator = new RunOrchestrator(
                collectors,
                context,
                stateStore,
                remoteRecorder,
                pruner,
                rowStore == null ? null : new RemoteSnapshotLoader(rowStore),
                writer
        );

        if (!options.serve()) {
            try {
                RunReport report = orchestrator.runOnce(options.source());
                LOGGER.info("Refresh done: " + report.collectors().keySet() + ", batch clean=" + report.batch().clean());
            } finally {
                if (browser != null) {
                    browser.close();
                }
            }
            return;
        }

        int port = Integer.parseInt(env.getOrDefault("PORT", "3001"));
        ApiServer apiServer = new ApiServer(port, stateStore, changeEvents, orchestrator, clock);
        apiServer.start();
        LOGGER.info("API listening on port " + apiServer.actualPort());

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            apiServer.stop();
            if (browser != null) {
                browser.close();
            }
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading logging.properties", e);
        }
    }

    record CliOptions(boolean serve, Optional<String> source) {
        static CliOptions parse(String[] args) {
            boolean serve = false;
            String source = null;
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--serve" -> serve = true;
                    case "--source" -> {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("--source needs a source id");
                        }
                        source = args[++i];
                    }
                    default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
                }
            }
            return new CliOptions(serve, Optional.ofNullable(source));
        }
    }
}
