package com.newsboard.collectors.scoring;

public enum SignalKind {
    URL,
    TITLE,
    ANCESTOR,
    DESCENDANT
}
