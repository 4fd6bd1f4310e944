package com.newsboard.core.history;

public enum UpsertKind {
    NONE,
    EXTENDED,
    NEW_URL,
    NEW_TITLE
}
