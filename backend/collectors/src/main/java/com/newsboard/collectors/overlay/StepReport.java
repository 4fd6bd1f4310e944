package com.newsboard.collectors.overlay;

public record StepReport(String step, StepOutcome outcome, String detail) {
}
