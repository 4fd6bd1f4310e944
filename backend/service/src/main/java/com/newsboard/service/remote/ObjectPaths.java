package com.newsboard.service.remote;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Objects;

public final class ObjectPaths {
    private ObjectPaths() {
    }

    public static String forRun(String prefix, String sourceId, Instant observedAt, String runId, String extension) {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
        Objects.requireNonNull(runId, "runId is required");
        LocalDate day = observedAt.atZone(ZoneOffset.UTC).toLocalDate();
        String datePath = String.format(Locale.ROOT, "%04d/%02d/%02d", day.getYear(), day.getMonthValue(), day.getDayOfMonth());
        String base = prefix == null || prefix.isBlank() ? "" : stripSlashes(prefix) + "/";
        return base + sourceId + "/" + datePath + "/" + runId + "." + extension;
    }

    private static String stripSlashes(String value) {
        String trimmed = value;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
