package com.newsboard.service.browser;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.ScreenshotType;
import com.microsoft.playwright.options.WaitUntilState;
import com.newsboard.collectors.api.Screenshot;
import com.newsboard.collectors.overlay.OverlayPage;
import com.newsboard.collectors.page.NavigationResult;
import com.newsboard.collectors.page.PageDriver;
import com.newsboard.collectors.page.ScreenshotRequest;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

public class PlaywrightPageDriver implements PageDriver {
    private static final Logger LOGGER = Logger.getLogger(PlaywrightPageDriver.class.getName());
    private static final Duration POLL_INTERVAL = Duration.ofMillis(250);

    private final BrowserContext context;
    private final Page page;

    PlaywrightPageDriver(BrowserContext context, Page page) {
        this.context = context;
        this.page = page;
    }

    @Override
    public NavigationResult navigate(String url, Duration timeout) {
        try {
            Response response = page.navigate(url, new Page.NavigateOptions()
                    .setTimeout(timeout.toMillis())
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
            int status = response == null ? 0 : response.status();
            if (status >= 400) {
                return new NavigationResult(NavigationResult.Status.FAILED, status, page.url(), page.title(),
                        "HTTP status " + status + " from " + url);
            }
            return NavigationResult.ok(status, page.url(), page.title());
        } catch (TimeoutError e) {
            return NavigationResult.timeout(url, "Navigation timed out after " + timeout.toMillis() + "ms: " + url);
        } catch (PlaywrightException e) {
            return NavigationResult.failed(url, 0, "Navigation to " + url + " failed: " + firstLine(e.getMessage()));
        }
    }

    @Override
    public <T> T evaluate(Function<Document, T> extraction) {
        return extraction.apply(snapshot());
    }

    @Override
    public boolean waitFor(Predicate<Document> condition, Duration timeout) {
        Instant deadline = Instant.now().plus(timeout);
        while (true) {
            if (condition.test(snapshot())) {
                return true;
            }
            if (!Instant.now().isBefore(deadline)) {
                return false;
            }
            page.waitForTimeout(POLL_INTERVAL.toMillis());
        }
    }

    @Override
    public void settle(Duration delay) {
        if (!delay.isZero() && !delay.isNegative()) {
            page.waitForTimeout(delay.toMillis());
        }
    }

    @Override
    public void scrollTo(int y) {
        page.evaluate("y => window.scrollTo(0, y)", y);
    }

    @Override
    public Optional<Screenshot> screenshot(ScreenshotRequest request) {
        byte[] bytes = page.screenshot(new Page.ScreenshotOptions()
                .setType(ScreenshotType.JPEG)
                .setQuality(request.quality()));
        return Optional.of(Screenshot.jpeg(bytes));
    }

    @Override
    public Optional<OverlayPage> overlays() {
        return Optional.of(new PlaywrightOverlayPage(page));
    }

    @Override
    public void close() {
        try {
            context.close();
        } catch (PlaywrightException e) {
            LOGGER.log(Level.FINE, "Browser context already gone", e);
        }
    }

    private Document snapshot() {
        return Jsoup.parse(page.content(), page.url());
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
