package com.newsboard.collectors.top10;

import com.newsboard.collectors.scoring.SourceProfile;

import java.util.List;

public record Top10CollectorConfig(List<SourceProfile> sources) {
    public Top10CollectorConfig {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public Top10CollectorConfig only(String sourceId) {
        return new Top10CollectorConfig(sources.stream().filter(source -> source.id().equals(sourceId)).toList());
    }

    public List<String> sourceIds() {
        return sources.stream().map(SourceProfile::id).toList();
    }
}
