package com.newsboard.core.model;

public enum ChangeEventType {
    ENTERED("ENTERED_TOP10"),
    EXITED("EXITED_TOP10"),
    MOVED("MOVED"),
    TITLE_UPDATED("TITLE_UPDATED");

    private final String storageName;

    ChangeEventType(String storageName) {
        this.storageName = storageName;
    }

    public String storageName() {
        return storageName;
    }
}
