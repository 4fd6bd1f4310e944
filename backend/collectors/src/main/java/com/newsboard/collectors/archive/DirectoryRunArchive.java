package com.newsboard.collectors.archive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsboard.core.model.SourceRun;
import com.newsboard.core.util.JsonUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

public class DirectoryRunArchive implements RunArchive {
    private static final Logger LOGGER = Logger.getLogger(DirectoryRunArchive.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path root;

    public DirectoryRunArchive(Path root) {
        this.root = root;
    }

    @Override
    public void archive(SourceRun run, String html) {
        Path dir = root.resolve(run.sourceId());
        try {
            Files.createDirectories(dir);
            if (html != null) {
                Files.writeString(htmlFile(run), html, StandardCharsets.UTF_8);
            }
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(jsonFile(run).toFile(), run);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Archiving run " + run.runId() + " to " + dir + " failed", e);
        }
    }

    public Path htmlFile(SourceRun run) {
        return root.resolve(run.sourceId()).resolve(run.runId() + ".html");
    }

    public Path jsonFile(SourceRun run) {
        return root.resolve(run.sourceId()).resolve(run.runId() + ".json");
    }
}
