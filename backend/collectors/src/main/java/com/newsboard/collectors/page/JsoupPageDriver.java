package com.newsboard.collectors.page;

import com.newsboard.collectors.api.Screenshot;
import com.newsboard.collectors.overlay.OverlayPage;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

public class JsoupPageDriver implements PageDriver {
    private static final Logger LOGGER = Logger.getLogger(JsoupPageDriver.class.getName());
    static final String USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/122.0.0.0 Safari/537.36";

    private final HttpClient httpClient;
    private Document document;

    public JsoupPageDriver(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public NavigationResult navigate(String url, Duration timeout) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .GET()
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .header("Accept-Language", "en-US,en;q=0.9")
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            String finalUrl = response.uri().toString();
            document = Jsoup.parse(response.body(), finalUrl);
            if (response.statusCode() >= 400) {
                return new NavigationResult(
                        NavigationResult.Status.FAILED,
                        response.statusCode(),
                        finalUrl,
                        document.title(),
                        "HTTP status " + response.statusCode() + " from " + url
                );
            }
            return NavigationResult.ok(response.statusCode(), finalUrl, document.title());
        } catch (HttpTimeoutException e) {
            return NavigationResult.timeout(url, "Request timed out while fetching " + url);
        } catch (IOException e) {
            return NavigationResult.failed(url, 0, classifyFailureMessage(url, e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return NavigationResult.failed(url, 0, "Interrupted while fetching " + url);
        }
    }

    @Override
    public <T> T evaluate(Function<Document, T> extraction) {
        return extraction.apply(requireDocument());
    }

    @Override
    public boolean waitFor(Predicate<Document> condition, Duration timeout) {
        return document != null && condition.test(document);
    }

    @Override
    public void settle(Duration delay) {
        LOGGER.log(Level.FINEST, "Static document, skipping settle of {0}", delay);
    }

    @Override
    public void scrollTo(int y) {
    }

    @Override
    public Optional<Screenshot> screenshot(ScreenshotRequest request) {
        return Optional.empty();
    }

    @Override
    public Optional<OverlayPage> overlays() {
        return Optional.empty();
    }

    @Override
    public void close() {
        document = null;
    }

    private Document requireDocument() {
        if (document == null) {
            throw new IllegalStateException("No page loaded");
        }
        return document;
    }

    static String classifyFailureMessage(String url, Throwable error) {
        Throwable root = error;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String lowered = rootText.toLowerCase(Locale.ROOT);
        if (root instanceof UnknownHostException
                || lowered.contains("unknown host")
                || lowered.contains("name or service")
                || lowered.contains("not known")
                || lowered.contains("nodename")) {
            return "DNS/unknown host while fetching " + url + ": " + rootText;
        }
        if (lowered.contains("timed out")) {
            return "Request timed out while fetching " + url;
        }
        return "Fetch failure for " + url + ": " + rootText;
    }
}
