package com.newsboard.collectors.page;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

public final class BlockDetector {
    private static final Pattern CAPTCHA = Pattern.compile("captcha|are you a robot|verify you are human");
    private static final Pattern INTERSTITIAL = Pattern.compile("interstitial|access denied|forbidden|blocked");

    private BlockDetector() {
    }

    public static Optional<String> detect(int httpStatus, String finalUrl, String pageTitle, String errorText) {
        if (httpStatus == 403) {
            return Optional.of("http_403");
        }
        if (httpStatus == 429) {
            return Optional.of("http_429");
        }
        String haystack = (nullToEmpty(finalUrl) + " " + nullToEmpty(pageTitle) + " " + nullToEmpty(errorText))
                .toLowerCase(Locale.ROOT);
        if (CAPTCHA.matcher(haystack).find()) {
            return Optional.of("captcha");
        }
        if (INTERSTITIAL.matcher(haystack).find()) {
            return Optional.of("interstitial");
        }
        return Optional.empty();
    }

    public static Optional<String> detect(NavigationResult navigation) {
        return detect(navigation.httpStatus(), navigation.finalUrl(), navigation.pageTitle(), navigation.error());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
