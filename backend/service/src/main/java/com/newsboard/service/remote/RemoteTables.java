package com.newsboard.service.remote;

public final class RemoteTables {
    public static final String SOURCE_RUNS = "source_runs";
    public static final String SCREENSHOT_EVENTS = "screenshot_events";
    public static final String TOP10_RUNS = "top10_runs";
    public static final String TOP10_ITEMS = "top10_items";
    public static final String TOP10_EVENTS = "top10_events";

    private RemoteTables() {
    }
}
