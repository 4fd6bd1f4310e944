package com.newsboard.core.model;

import java.time.Instant;
import java.util.Objects;

public record ResidencyEntry(
        String url,
        String title,
        String imageUrl,
        Instant firstSeenAt,
        Instant lastSeenAt,
        int seenCount
) {
    public ResidencyEntry {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(firstSeenAt, "firstSeenAt is required");
        Objects.requireNonNull(lastSeenAt, "lastSeenAt is required");
        title = title == null ? "" : title;
        if (seenCount < 1) {
            throw new IllegalArgumentException("seenCount must be positive");
        }
    }

    public static ResidencyEntry start(HeroItem item, Instant observedAt) {
        return new ResidencyEntry(item.url(), item.title(), item.imageUrl(), observedAt, observedAt, 1);
    }

    public ResidencyEntry extend(Instant observedAt, String nextImageUrl) {
        return new ResidencyEntry(
                url,
                title,
                nextImageUrl != null ? nextImageUrl : imageUrl,
                firstSeenAt,
                observedAt,
                seenCount + 1
        );
    }
}
