package com.newsboard.service.write;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Units run once, in insertion order. After {@code breakerThreshold} outage-like failures the rest are
 * skipped. {@link #run()} reports unit failures instead of throwing them.
 */
public class WriteBatch {
    private static final Logger LOGGER = Logger.getLogger(WriteBatch.class.getName());

    private final RetryingWriter writer;
    private final List<Unit> units = new ArrayList<>();
    private boolean ran;

    public WriteBatch(RetryingWriter writer) {
        this.writer = writer;
    }

    public WriteBatch add(String label, Runnable work) {
        return add(label, null, work);
    }

    public WriteBatch add(String label, String prerequisite, Runnable work) {
        Objects.requireNonNull(label, "label is required");
        Objects.requireNonNull(work, "work is required");
        if (ran) {
            throw new IllegalStateException("batch already ran");
        }
        units.add(new Unit(label, prerequisite, work));
        return this;
    }

    public int size() {
        return units.size();
    }

    public synchronized BatchOutcome run() {
        if (ran) {
            throw new IllegalStateException("batch already ran");
        }
        ran = true;
        int threshold = writer.policy().breakerThreshold();
        List<String> succeeded = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        Set<String> ok = new HashSet<>();
        int outageFailures = 0;
        boolean tripped = false;

        for (Unit unit : units) {
            if (tripped) {
                skipped.add(unit.label());
                continue;
            }
            if (unit.prerequisite() != null && !ok.contains(unit.prerequisite())) {
                skipped.add(unit.label());
                continue;
            }
            try {
                writer.run(unit.label(), unit.work());
                succeeded.add(unit.label());
                ok.add(unit.label());
            } catch (WriteFailedException e) {
                failures.put(unit.label(), e.diagnostic());
                LOGGER.warning("Write unit " + unit.label() + " failed: " + e.diagnostic());
                if (e.outageLike()) {
                    outageFailures++;
                    if (outageFailures >= threshold) {
                        tripped = true;
                        LOGGER.warning("Store looks unavailable after " + outageFailures
                                + " outage-like failures, skipping the rest of the batch");
                    }
                }
            }
        }
        return new BatchOutcome(succeeded, failures, skipped, tripped);
    }

    private record Unit(String label, String prerequisite, Runnable work) {
    }
}
