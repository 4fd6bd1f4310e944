package com.newsboard.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.newsboard.collectors.hero.HeroCollectorConfig;
import com.newsboard.collectors.top10.Top10CollectorConfig;
import com.newsboard.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static HeroCollectorConfig loadHeroes(Path configDir) {
        return read(configDir.resolve("heroes.json"), new TypeReference<>() {
        });
    }

    public static Top10CollectorConfig loadTop10(Path configDir) {
        return read(configDir.resolve("top10.json"), new TypeReference<>() {
        });
    }

    public static PipelineConfig loadPipeline(Path configDir) {
        Path path = configDir.resolve("pipeline.json");
        if (!Files.exists(path)) {
            return PipelineConfig.DEFAULT;
        }
        return read(path, new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
