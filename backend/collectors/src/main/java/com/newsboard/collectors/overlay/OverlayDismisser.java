package com.newsboard.collectors.overlay;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Best-effort overlay cleanup. {@link #dismiss} never throws and is safe to call twice on a page.
 */
public class OverlayDismisser {
    private static final Logger LOGGER = Logger.getLogger(OverlayDismisser.class.getName());

    public static final String ESCAPE = "escape";
    public static final String CONSENT_BUTTON = "consent-button";
    public static final String CLOSE_BUTTON = "close-button";
    public static final String CONSENT_FRAMES = "consent-frames";
    public static final String SWEEP = "sweep";

    static final List<Pattern> CONSENT_NAMES = List.of(
            button("accept"),
            button("accept all"),
            button("i agree"),
            button("agree"),
            button("continue"),
            button("got it"),
            button("ok"),
            button("okay")
    );
    static final List<String> CLOSE_SELECTORS = List.of(
            "button[aria-label*=\"close\" i]",
            "[data-testid*=\"close\" i]",
            "button:has-text(\"Close\")",
            "button:has-text(\"Not now\")",
            "button:has-text(\"No thanks\")",
            "button:has-text(\"×\")",
            "button:has-text(\"✕\")"
    );
    static final Pattern CONSENT_FRAME_URL =
            Pattern.compile("consent|onetrust|quantcast|trustarc|sourcepoint|didomi|cmp|privacy", Pattern.CASE_INSENSITIVE);

    private final Duration visibleTimeout;
    private final Duration clickTimeout;

    public OverlayDismisser() {
        this(Duration.ofMillis(250), Duration.ofMillis(1200));
    }

    public OverlayDismisser(Duration visibleTimeout, Duration clickTimeout) {
        this.visibleTimeout = visibleTimeout;
        this.clickTimeout = clickTimeout;
    }

    public DismissalReport dismiss(OverlayPage page) {
        List<StepReport> steps = new ArrayList<>();
        steps.add(run(ESCAPE, () -> {
            page.pressKey("Escape");
            return StepOutcome.SUCCEEDED;
        }));
        steps.add(run(CONSENT_BUTTON, () -> clickConsent(page)));
        steps.add(run(CLOSE_BUTTON, () -> clickClose(page)));
        steps.add(run(CONSENT_FRAMES, () -> {
            List<OverlayScope> frames = page.framesMatching(CONSENT_FRAME_URL);
            if (frames.isEmpty()) {
                return StepOutcome.NOT_APPLICABLE;
            }
            StepOutcome outcome = StepOutcome.NOT_APPLICABLE;
            for (OverlayScope frame : frames) {
                StepOutcome consent = clickConsent(frame);
                StepOutcome close = clickClose(frame);
                if (consent == StepOutcome.SUCCEEDED || close == StepOutcome.SUCCEEDED) {
                    outcome = StepOutcome.SUCCEEDED;
                }
            }
            return outcome;
        }));
        steps.add(run(SWEEP, () -> sweep(page)));
        return new DismissalReport(steps);
    }

    private StepOutcome clickConsent(OverlayScope scope) {
        for (Pattern name : CONSENT_NAMES) {
            if (scope.clickButtonNamed(name, visibleTimeout, clickTimeout)) {
                return StepOutcome.SUCCEEDED;
            }
        }
        return StepOutcome.NOT_APPLICABLE;
    }

    private StepOutcome clickClose(OverlayScope scope) {
        for (String selector : CLOSE_SELECTORS) {
            if (scope.clickFirstVisible(selector, visibleTimeout, clickTimeout)) {
                return StepOutcome.SUCCEEDED;
            }
        }
        return StepOutcome.NOT_APPLICABLE;
    }

    private StepOutcome sweep(OverlayPage page) {
        Viewport viewport = page.viewport();
        List<OverlayCandidate> doomed = page.positionedElements().stream()
                .filter(candidate -> SweepCriteria.matches(candidate, viewport))
                .toList();
        if (doomed.isEmpty()) {
            return StepOutcome.NOT_APPLICABLE;
        }
        return page.remove(doomed) > 0 ? StepOutcome.SUCCEEDED : StepOutcome.NOT_APPLICABLE;
    }

    private StepReport run(String step, Supplier<StepOutcome> action) {
        try {
            return new StepReport(step, action.get(), null);
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "Overlay step " + step + " failed, continuing", e);
            return new StepReport(step, StepOutcome.FAILED_IGNORED, e.getMessage());
        }
    }

    private static Pattern button(String name) {
        return Pattern.compile("^" + Pattern.quote(name) + "$", Pattern.CASE_INSENSITIVE);
    }
}
