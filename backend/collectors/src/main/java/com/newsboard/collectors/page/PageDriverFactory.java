package com.newsboard.collectors.page;

@FunctionalInterface
public interface PageDriverFactory {
    PageDriver open();
}
