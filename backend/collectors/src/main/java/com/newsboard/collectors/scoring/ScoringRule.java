package com.newsboard.collectors.scoring;

import com.newsboard.core.model.Candidate;

import java.util.Objects;

public record ScoringRule(String signal, double weight, Double min, Double max) {
    public ScoringRule {
        Objects.requireNonNull(signal, "signal is required");
    }

    public static ScoringRule flag(String signal, double weight) {
        return new ScoringRule(signal, weight, null, null);
    }

    public static ScoringRule range(String signal, double weight, Double min, Double max) {
        return new ScoringRule(signal, weight, min, max);
    }

    public double apply(Candidate candidate) {
        Object value = candidate.signals().get(signal);
        if (value instanceof Boolean flag) {
            return flag ? weight : 0;
        }
        if (value instanceof Number number) {
            double numeric = number.doubleValue();
            boolean aboveMin = min == null || numeric >= min;
            boolean belowMax = max == null || numeric <= max;
            return aboveMin && belowMax ? weight : 0;
        }
        return 0;
    }
}
