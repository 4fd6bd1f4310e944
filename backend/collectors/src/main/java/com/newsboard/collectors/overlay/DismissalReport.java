package com.newsboard.collectors.overlay;

import java.util.List;
import java.util.Optional;

public record DismissalReport(List<StepReport> steps) {
    public DismissalReport {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public Optional<StepOutcome> outcome(String step) {
        return steps.stream().filter(report -> report.step().equals(step)).map(StepReport::outcome).findFirst();
    }

    public boolean anySucceeded() {
        return steps.stream().anyMatch(report -> report.outcome() == StepOutcome.SUCCEEDED);
    }
}
