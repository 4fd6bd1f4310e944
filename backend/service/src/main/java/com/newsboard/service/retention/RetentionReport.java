package com.newsboard.service.retention;

import java.util.Map;

public record RetentionReport(
        int residencyEntriesRemoved,
        int changeEventsRemoved,
        int screenshotRowsRemoved,
        int screenshotObjectsRemoved,
        Map<String, String> failures
) {
    public RetentionReport {
        failures = failures == null ? Map.of() : Map.copyOf(failures);
    }
}
