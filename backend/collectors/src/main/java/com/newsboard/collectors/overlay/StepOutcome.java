package com.newsboard.collectors.overlay;

public enum StepOutcome {
    SUCCEEDED,
    NOT_APPLICABLE,
    FAILED_IGNORED
}
