package com.newsboard.collectors.page;

import com.newsboard.collectors.api.Screenshot;
import com.newsboard.collectors.overlay.OverlayPage;
import org.jsoup.nodes.Document;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

public interface PageDriver extends AutoCloseable {
    NavigationResult navigate(String url, Duration timeout);

    <T> T evaluate(Function<Document, T> extraction);

    boolean waitFor(Predicate<Document> condition, Duration timeout);

    void settle(Duration delay);

    void scrollTo(int y);

    Optional<Screenshot> screenshot(ScreenshotRequest request);

    Optional<OverlayPage> overlays();

    @Override
    void close();
}
