package com.newsboard.core.model;

import com.newsboard.core.util.Fingerprints;
import com.newsboard.core.util.TextUtils;

import java.util.Objects;

public record RankedItem(int rank, String title, String url, String fingerprint) {
    public RankedItem {
        Objects.requireNonNull(fingerprint, "fingerprint is required");
        title = title == null ? "" : title;
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be >= 1, got " + rank);
        }
    }

    public static RankedItem of(int rank, String rawTitle, String rawUrl) {
        String title = TextUtils.cleanText(rawTitle);
        String url = rawUrl == null ? null : TextUtils.normalizeUrl(rawUrl);
        return new RankedItem(rank, title, url, Fingerprints.fingerprint(title, url));
    }
}
