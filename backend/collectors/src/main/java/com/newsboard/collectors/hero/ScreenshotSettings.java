package com.newsboard.collectors.hero;

import com.newsboard.collectors.page.ScreenshotRequest;

import java.time.Duration;

public record ScreenshotSettings(
        boolean enabled,
        boolean dismissOverlays,
        int scrollY,
        long settleMillis,
        int quality
) {
    public static final ScreenshotSettings DISABLED = new ScreenshotSettings(false, false, 0, 700, 70);

    public ScreenshotSettings {
        quality = quality <= 0 ? ScreenshotRequest.DEFAULT.quality() : quality;
        settleMillis = Math.max(0, settleMillis);
    }

    public ScreenshotRequest toRequest() {
        return new ScreenshotRequest(scrollY, Duration.ofMillis(settleMillis), quality);
    }
}
