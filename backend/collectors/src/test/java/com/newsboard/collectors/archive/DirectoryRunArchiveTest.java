package com.newsboard.collectors.archive;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsboard.core.model.FailureKind;
import com.newsboard.core.model.HeroItem;
import com.newsboard.core.model.SourceRun;
import com.newsboard.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectoryRunArchiveTest {
    private static final Instant T0 = Instant.parse("2026-02-13T14:00:00Z");

    @Test
    void writesPageAndRunPerSource() throws Exception {
        Path root = Files.createTempDirectory("run-archive-");
        DirectoryRunArchive archive = new DirectoryRunArchive(root.resolve("archive"));
        SourceRun run = SourceRun.success("run-1", "cbs1", T0,
                HeroItem.of("Storm hits the coast overnight", "https://www.cbsnews.example/news/storm/", null));

        archive.archive(run, "<html><body>front page</body></html>");

        assertEquals("<html><body>front page</body></html>", Files.readString(archive.htmlFile(run)));
        JsonNode json = JsonUtils.objectMapper().readTree(archive.jsonFile(run).toFile());
        assertEquals("run-1", json.get("runId").asText());
        assertEquals("Storm hits the coast overnight", json.get("item").get("title").asText());
        assertEquals(root.resolve("archive").resolve("cbs1").resolve("run-1.json"), archive.jsonFile(run));
    }

    @Test
    void failedNavigationKeepsOnlyTheRun() throws Exception {
        Path root = Files.createTempDirectory("run-archive-failed-");
        DirectoryRunArchive archive = new DirectoryRunArchive(root);
        SourceRun run = SourceRun.failure("run-2", "abc1", T0, FailureKind.NAVIGATION_TIMEOUT, "timed out");

        archive.archive(run, null);

        assertFalse(Files.exists(archive.htmlFile(run)));
        assertEquals("NAVIGATION_TIMEOUT",
                JsonUtils.objectMapper().readTree(archive.jsonFile(run).toFile()).get("failure").asText());
    }

    @Test
    void unwritableArchiveIsLoggedNotThrown() throws Exception {
        Path blocker = Files.createTempFile("run-archive-", ".txt");
        DirectoryRunArchive archive = new DirectoryRunArchive(blocker);
        SourceRun run = SourceRun.failure("run-3", "abc1", T0, FailureKind.NAVIGATION, "refused");

        assertDoesNotThrow(() -> archive.archive(run, "<html></html>"));
        assertTrue(Files.isRegularFile(blocker));
    }
}
