package com.newsboard.service.write;

import com.newsboard.service.remote.StoreException;
import org.jsoup.Jsoup;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class FailureDiagnostics {
    private static final Pattern LOOKS_LIKE_HTML = Pattern.compile("<\\s*(!doctype|html|head|body|title|div|h1|p)\\b",
            Pattern.CASE_INSENSITIVE);

    private FailureDiagnostics() {
    }

    public static String compact(Throwable error, int limit) {
        List<String> parts = new ArrayList<>();
        StoreException store = findStoreException(error);
        if (store != null) {
            if (store.status() > 0) {
                parts.add("status=" + store.status());
            }
            addField(parts, "code", store.code());
            addField(parts, "details", store.details());
            addField(parts, "hint", store.hint());
        }
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        parts.add(flatten(message));
        return truncate(String.join(" ", parts), limit);
    }

    static String flatten(String text) {
        if (text == null) {
            return "";
        }
        String plain = LOOKS_LIKE_HTML.matcher(text).find() ? Jsoup.parse(text).text() : text;
        return plain.replaceAll("\\s+", " ").trim();
    }

    static String truncate(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        return text.substring(0, Math.max(0, limit - 1)) + "…";
    }

    private static void addField(List<String> parts, String name, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(name + "=" + flatten(value));
        }
    }

    private static StoreException findStoreException(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof StoreException store) {
                return store;
            }
        }
        return null;
    }
}
