package com.newsboard.collectors.scoring;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

public record SourceProfile(
        String id,
        String name,
        String homeUrl,
        String waitSelector,
        long settleMillis,
        List<String> selectors,
        List<String> titleSelectors,
        String titleSuffixPattern,
        List<String> imageScopes,
        String excludedAncestor,
        List<String> storyUrlPatterns,
        List<String> excludedUrlPatterns,
        List<SignalDefinition> signals,
        List<ScoringRule> rules,
        int minTitleLength,
        int maxItems
) {
    public static final int DEFAULT_MIN_TITLE_LENGTH = 20;

    public SourceProfile {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(homeUrl, "homeUrl is required");
        name = name == null ? id : name;
        selectors = selectors == null ? List.of() : List.copyOf(selectors);
        if (selectors.isEmpty()) {
            throw new IllegalArgumentException("source " + id + " needs at least one selector");
        }
        titleSelectors = titleSelectors == null ? List.of() : List.copyOf(titleSelectors);
        imageScopes = imageScopes == null ? List.of() : List.copyOf(imageScopes);
        storyUrlPatterns = storyUrlPatterns == null ? List.of() : List.copyOf(storyUrlPatterns);
        excludedUrlPatterns = excludedUrlPatterns == null ? List.of() : List.copyOf(excludedUrlPatterns);
        signals = signals == null ? List.of() : List.copyOf(signals);
        rules = rules == null ? List.of() : List.copyOf(rules);
        minTitleLength = minTitleLength <= 0 ? DEFAULT_MIN_TITLE_LENGTH : minTitleLength;
        maxItems = maxItems <= 0 ? 1 : maxItems;
        settleMillis = Math.max(0, settleMillis);
    }

    public boolean isStoryUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        for (String excluded : excludedUrlPatterns) {
            if (find(excluded, url)) {
                return false;
            }
        }
        if (storyUrlPatterns.isEmpty()) {
            return true;
        }
        for (String pattern : storyUrlPatterns) {
            if (find(pattern, url)) {
                return true;
            }
        }
        return false;
    }

    private static boolean find(String regex, String value) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE).matcher(value).find();
    }
}
