package com.newsboard.service.write;

public class WriteFailedException extends RuntimeException {
    private final String label;
    private final int attempts;
    private final boolean transientFailure;
    private final boolean outageLike;
    private final String diagnostic;

    public WriteFailedException(
            String label,
            int attempts,
            boolean transientFailure,
            boolean outageLike,
            String diagnostic,
            Throwable cause
    ) {
        super(label + " failed after " + attempts + " attempt(s): " + diagnostic, cause);
        this.label = label;
        this.attempts = attempts;
        this.transientFailure = transientFailure;
        this.outageLike = outageLike;
        this.diagnostic = diagnostic;
    }

    public String label() {
        return label;
    }

    public int attempts() {
        return attempts;
    }

    public boolean transientFailure() {
        return transientFailure;
    }

    public boolean outageLike() {
        return outageLike;
    }

    public String diagnostic() {
        return diagnostic;
    }
}
