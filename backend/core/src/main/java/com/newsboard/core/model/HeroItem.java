package com.newsboard.core.model;

import com.newsboard.core.util.Fingerprints;
import com.newsboard.core.util.TextUtils;

import java.util.Objects;

public record HeroItem(
        String title,
        String url,
        String imageUrl,
        String fingerprint
) {
    public HeroItem {
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(fingerprint, "fingerprint is required");
    }

    public static HeroItem of(String rawTitle, String rawUrl, String rawImageUrl) {
        String title = TextUtils.cleanText(rawTitle);
        String url = TextUtils.normalizeUrl(rawUrl);
        String imageUrl = rawImageUrl == null || rawImageUrl.isBlank() ? null : TextUtils.normalizeUrl(rawImageUrl);
        return new HeroItem(title, url, imageUrl, Fingerprints.fingerprint(title, url));
    }

    public static HeroItem from(Candidate candidate) {
        return of(candidate.title(), candidate.url(), candidate.imageUrl());
    }
}
