package com.newsboard.collectors.page;

import java.time.Duration;

public record ScreenshotRequest(int scrollY, Duration settle, int quality) {
    public static final ScreenshotRequest DEFAULT = new ScreenshotRequest(0, Duration.ofMillis(700), 70);

    public ScreenshotRequest {
        settle = settle == null ? Duration.ZERO : settle;
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("quality must be within 1..100, got " + quality);
        }
    }
}
