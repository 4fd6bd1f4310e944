package com.newsboard.collectors.api;

public interface Collector {
    String name();

    CollectorResult poll(CollectorContext ctx);
}
