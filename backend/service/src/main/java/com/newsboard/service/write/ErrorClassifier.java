package com.newsboard.service.write;

import com.newsboard.service.remote.StoreException;

import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class ErrorClassifier {
    static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 425, 429, 500, 502, 503, 504, 520, 522, 524);
    static final Set<Integer> OUTAGE_STATUSES = Set.of(502, 503, 504, 520, 522, 524);

    private static final Pattern TRANSIENT_TEXT = Pattern.compile(
            "timed? ?out|timeout|connection reset|econnreset|etimedout|fetch failed|socket hang up|temporarily unavailable",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern OUTAGE_TEXT = Pattern.compile(
            "bad gateway|service unavailable|gateway time-?out|origin unreachable|cloudflare|upstream connect error",
            Pattern.CASE_INSENSITIVE
    );

    private ErrorClassifier() {
    }

    public static boolean isTransient(Throwable error) {
        int status = statusOf(error);
        if (TRANSIENT_STATUSES.contains(status)) {
            return true;
        }
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof HttpTimeoutException || current instanceof ConnectException) {
                return true;
            }
            if (current instanceof IllegalArgumentException) {
                return false;
            }
        }
        return TRANSIENT_TEXT.matcher(textOf(error)).find();
    }

    public static boolean isOutageLike(Throwable error) {
        if (!isTransient(error)) {
            return false;
        }
        return OUTAGE_STATUSES.contains(statusOf(error)) || OUTAGE_TEXT.matcher(textOf(error)).find();
    }

    static int statusOf(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof StoreException store && store.status() > 0) {
                return store.status();
            }
        }
        return 0;
    }

    private static String textOf(Throwable error) {
        StringBuilder text = new StringBuilder();
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current.getMessage() != null) {
                text.append(current.getMessage()).append(' ');
            }
            if (current instanceof StoreException store) {
                append(text, store.code());
                append(text, store.details());
                append(text, store.hint());
            }
        }
        return text.toString().toLowerCase(Locale.ROOT);
    }

    private static void append(StringBuilder text, String value) {
        if (value != null) {
            text.append(value).append(' ');
        }
    }
}
