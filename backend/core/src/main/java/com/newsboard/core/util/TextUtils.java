package com.newsboard.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00a0]+");
    private static final Set<String> TRACKING_PARAMS = Set.of("fbclid", "gclid", "dclid", "mc_cid", "mc_eid");

    private TextUtils() {
    }

    public static String cleanText(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    public static String normalizeUrl(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            String rawQuery = uri.getRawQuery();
            if (rawQuery == null) {
                return trimmed;
            }
            List<String> kept = new ArrayList<>();
            for (String pair : rawQuery.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                String key = pair.split("=", 2)[0].toLowerCase(Locale.ROOT);
                if (key.startsWith("utm_") || TRACKING_PARAMS.contains(key)) {
                    continue;
                }
                kept.add(pair);
            }
            String query = kept.isEmpty() ? null : String.join("&", kept);
            StringBuilder rebuilt = new StringBuilder();
            if (uri.getScheme() != null) {
                rebuilt.append(uri.getScheme()).append(':');
            }
            if (uri.getRawAuthority() != null) {
                rebuilt.append("//").append(uri.getRawAuthority());
            }
            if (uri.getRawPath() != null) {
                rebuilt.append(uri.getRawPath());
            }
            if (query != null) {
                rebuilt.append('?').append(query);
            }
            if (uri.getRawFragment() != null) {
                rebuilt.append('#').append(uri.getRawFragment());
            }
            return rebuilt.toString();
        } catch (URISyntaxException e) {
            return trimmed;
        }
    }

    public static String absolutize(String base, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        try {
            URI resolved = base == null || base.isBlank() ? new URI(href.trim()) : new URI(base).resolve(href.trim());
            return resolved.isAbsolute() ? resolved.toString() : null;
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    public static String bestFromSrcset(String srcset) {
        if (srcset == null || srcset.isBlank()) {
            return null;
        }
        String bestUrl = null;
        int bestWidth = -1;
        String last = null;
        for (String part : srcset.split(",")) {
            String[] tokens = part.trim().split("\\s+");
            if (tokens.length == 0 || tokens[0].isEmpty()) {
                continue;
            }
            last = tokens[0];
            int width = 0;
            if (tokens.length > 1 && tokens[1].endsWith("w")) {
                try {
                    width = Integer.parseInt(tokens[1].substring(0, tokens[1].length() - 1));
                } catch (NumberFormatException ignored) {
                    width = 0;
                }
            }
            if (width > bestWidth) {
                bestWidth = width;
                bestUrl = tokens[0];
            }
        }
        return bestWidth > 0 ? bestUrl : last;
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, Math.max(0, maxLength - 1)) + "…";
    }
}
