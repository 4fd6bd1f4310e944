package com.newsboard.service.write;

import java.time.Duration;

public record WritePolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration maxJitter,
        int breakerThreshold,
        int diagnosticLimit
) {
    public static final WritePolicy DEFAULT = new WritePolicy(3, Duration.ofMillis(400), Duration.ofMillis(250), 2, 400);

    public WritePolicy {
        maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ofMillis(400) : baseDelay;
        maxJitter = maxJitter == null || maxJitter.isNegative() ? Duration.ofMillis(250) : maxJitter;
        breakerThreshold = breakerThreshold <= 0 ? 2 : breakerThreshold;
        diagnosticLimit = diagnosticLimit <= 0 ? 400 : diagnosticLimit;
    }

    public Duration backoff(int attempt) {
        return baseDelay.multipliedBy(1L << Math.max(0, attempt - 1));
    }
}
