package com.newsboard.collectors.hero;

import com.newsboard.collectors.scoring.SourceProfile;

import java.util.List;

public record HeroCollectorConfig(List<SourceProfile> sources, ScreenshotSettings screenshots) {
    public HeroCollectorConfig {
        sources = sources == null ? List.of() : List.copyOf(sources);
        screenshots = screenshots == null ? ScreenshotSettings.DISABLED : screenshots;
    }

    public HeroCollectorConfig only(String sourceId) {
        return new HeroCollectorConfig(
                sources.stream().filter(source -> source.id().equals(sourceId)).toList(),
                screenshots
        );
    }

    public List<String> sourceIds() {
        return sources.stream().map(SourceProfile::id).toList();
    }
}
