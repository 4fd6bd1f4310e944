package com.newsboard.core.util;

import java.util.Locale;

/**
 * Stable content keys for stories. The normalized url is the key whenever one exists, so a story keeps
 * its key across headline edits; url-less items fall back to their lower-cased title.
 */
public final class Fingerprints {
    private Fingerprints() {
    }

    public static String fingerprint(String title, String url) {
        String normalizedUrl = url == null ? "" : TextUtils.normalizeUrl(url.trim());
        if (normalizedUrl != null && !normalizedUrl.isBlank()) {
            return HashingUtils.sha1("u|" + normalizedUrl);
        }
        return HashingUtils.sha1("t|" + TextUtils.cleanText(title).toLowerCase(Locale.ROOT));
    }

    public static String slotKey(String sourceId, String slot) {
        return HashingUtils.sha1(sourceId + "|" + slot).substring(0, 12);
    }
}
