package com.newsboard.collectors.page;

import java.net.http.HttpClient;
import java.util.Objects;

public class JsoupPageDriverFactory implements PageDriverFactory {
    private final HttpClient httpClient;

    public JsoupPageDriverFactory(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    }

    @Override
    public PageDriver open() {
        return new JsoupPageDriver(httpClient);
    }
}
