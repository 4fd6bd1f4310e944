package com.newsboard.service.write;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record BatchOutcome(
        List<String> succeeded,
        Map<String, String> failures,
        List<String> skipped,
        boolean breakerTripped
) {
    public static final BatchOutcome EMPTY = new BatchOutcome(List.of(), Map.of(), List.of(), false);

    public BatchOutcome {
        succeeded = succeeded == null ? List.of() : List.copyOf(succeeded);
        failures = failures == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public boolean clean() {
        return failures.isEmpty() && skipped.isEmpty();
    }
}
