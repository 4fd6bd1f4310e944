package com.newsboard.core.model;

public enum FailureKind {
    EXTRACTION,
    BLOCKED,
    NAVIGATION_TIMEOUT,
    NAVIGATION
}
