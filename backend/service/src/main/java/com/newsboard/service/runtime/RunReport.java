package com.newsboard.service.runtime;

import com.newsboard.collectors.api.CollectorResult;
import com.newsboard.service.retention.RetentionReport;
import com.newsboard.service.write.BatchOutcome;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RunReport(
        Instant startedAt,
        Instant finishedAt,
        Map<String, CollectorResult> collectors,
        BatchOutcome batch,
        RetentionReport retention
) {
    public RunReport {
        collectors = collectors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(collectors));
        batch = batch == null ? BatchOutcome.EMPTY : batch;
    }

    public boolean success() {
        return collectors.values().stream().allMatch(CollectorResult::success) && batch.clean();
    }
}
