package com.newsboard.service.retention;

import java.time.Duration;

public record RetentionPolicy(
        Duration historyMaxAge,
        Duration eventMaxAge,
        Duration screenshotMaxAge,
        int pageSize
) {
    public static final RetentionPolicy DEFAULT =
            new RetentionPolicy(Duration.ofDays(30), Duration.ofDays(30), Duration.ofHours(12), 500);

    public RetentionPolicy {
        historyMaxAge = historyMaxAge == null ? Duration.ofDays(30) : historyMaxAge;
        eventMaxAge = eventMaxAge == null ? Duration.ofDays(30) : eventMaxAge;
        screenshotMaxAge = screenshotMaxAge == null ? Duration.ofHours(12) : screenshotMaxAge;
        pageSize = pageSize <= 0 ? 500 : pageSize;
    }
}
