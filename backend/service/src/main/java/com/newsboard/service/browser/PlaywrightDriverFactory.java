package com.newsboard.service.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.newsboard.collectors.page.PageDriver;
import com.newsboard.collectors.page.PageDriverFactory;

import java.util.logging.Logger;

public class PlaywrightDriverFactory implements PageDriverFactory, AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(PlaywrightDriverFactory.class.getName());

    static final int VIEWPORT_WIDTH = 1440;
    static final int VIEWPORT_HEIGHT = 900;
    static final String LOCALE = "en-US";
    static final String USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/122.0.0.0 Safari/537.36";

    private final Playwright playwright;
    private final Browser browser;

    PlaywrightDriverFactory(Playwright playwright, Browser browser) {
        this.playwright = playwright;
        this.browser = browser;
    }

    public static PlaywrightDriverFactory launch() {
        Playwright playwright = Playwright.create();
        try {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(true));
            LOGGER.info("Launched headless Chromium " + browser.version());
            return new PlaywrightDriverFactory(playwright, browser);
        } catch (RuntimeException e) {
            playwright.close();
            throw new IllegalStateException("Failed launching Chromium", e);
        }
    }

    @Override
    public PageDriver open() {
        BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                .setViewportSize(VIEWPORT_WIDTH, VIEWPORT_HEIGHT)
                .setLocale(LOCALE)
                .setUserAgent(USER_AGENT));
        return new PlaywrightPageDriver(context, context.newPage());
    }

    @Override
    public void close() {
        browser.close();
        playwright.close();
    }
}
