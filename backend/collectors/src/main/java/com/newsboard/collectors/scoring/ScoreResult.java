package com.newsboard.collectors.scoring;

import java.util.List;
import java.util.Optional;

public record ScoreResult(boolean ok, List<ScoredCandidate> ranked, String reason) {
    public ScoreResult {
        ranked = ranked == null ? List.of() : List.copyOf(ranked);
        if (ok && ranked.isEmpty()) {
            throw new IllegalArgumentException("ok result needs at least one candidate");
        }
    }

    public static ScoreResult ok(List<ScoredCandidate> ranked) {
        return new ScoreResult(true, ranked, null);
    }

    public static ScoreResult failure(String reason) {
        return new ScoreResult(false, List.of(), reason);
    }

    public Optional<ScoredCandidate> winner() {
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }
}
