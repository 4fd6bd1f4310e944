package com.newsboard.collectors.overlay;

import java.util.Locale;
import java.util.regex.Pattern;

public final class SweepCriteria {
    public static final int MIN_Z_INDEX = 1000;
    public static final double MIN_VIEWPORT_COVERAGE = 0.40;

    private static final Pattern CLASS_OR_ID = Pattern.compile("modal|overlay|paywall|subscribe|consent|cookie|gdpr|privacy");
    private static final Pattern TEXT = Pattern.compile("cookie|privacy|consent|subscribe|sign in|continue reading");
    private static final int TEXT_PREFIX = 200;

    private SweepCriteria() {
    }

    public static boolean matches(OverlayCandidate candidate, Viewport viewport) {
        String position = lower(candidate.position());
        if (!position.equals("fixed") && !position.equals("sticky")) {
            return false;
        }
        if (candidate.zIndex() < MIN_Z_INDEX) {
            return false;
        }
        if (viewport.area() <= 0 || candidate.area() < viewport.area() * MIN_VIEWPORT_COVERAGE) {
            return false;
        }
        return hasOverlaySignal(candidate);
    }

    static boolean hasOverlaySignal(OverlayCandidate candidate) {
        if ("dialog".equals(lower(candidate.role()))) {
            return true;
        }
        String classAndId = lower(candidate.className()) + " " + lower(candidate.elementId());
        if (CLASS_OR_ID.matcher(classAndId).find()) {
            return true;
        }
        String text = lower(candidate.text());
        if (text.length() > TEXT_PREFIX) {
            text = text.substring(0, TEXT_PREFIX);
        }
        return TEXT.matcher(text).find();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
