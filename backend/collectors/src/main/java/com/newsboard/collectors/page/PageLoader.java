package com.newsboard.collectors.page;

import com.newsboard.collectors.scoring.CandidateExtractor;
import com.newsboard.collectors.scoring.SourceProfile;
import com.newsboard.core.model.Candidate;
import com.newsboard.core.model.FailureKind;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public class PageLoader {
    private static final Logger LOGGER = Logger.getLogger(PageLoader.class.getName());

    private final CandidateExtractor extractor;

    public PageLoader() {
        this(new CandidateExtractor());
    }

    public PageLoader(CandidateExtractor extractor) {
        this.extractor = extractor;
    }

    public PageLoad load(PageDriver driver, SourceProfile profile, Duration navigationTimeout, Duration waitTimeout) {
        NavigationResult navigation = driver.navigate(profile.homeUrl(), navigationTimeout);
        if (navigation.status() == NavigationResult.Status.TIMEOUT) {
            return PageLoad.failed(FailureKind.NAVIGATION_TIMEOUT, profile.name() + ": navigation timed out after "
                    + navigationTimeout.toMillis() + "ms", 0);
        }
        Optional<String> blocked = BlockDetector.detect(navigation);
        if (blocked.isPresent()) {
            return PageLoad.failed(FailureKind.BLOCKED, profile.name() + ": blocked: " + blocked.get(),
                    navigation.httpStatus());
        }
        if (navigation.status() == NavigationResult.Status.FAILED) {
            return PageLoad.failed(FailureKind.NAVIGATION, profile.name() + ": " + navigation.error(),
                    navigation.httpStatus());
        }

        if (profile.waitSelector() != null && !profile.waitSelector().isBlank()) {
            boolean appeared = driver.waitFor(doc -> doc.selectFirst(profile.waitSelector()) != null, waitTimeout);
            if (!appeared) {
                LOGGER.log(Level.FINE, "Wait selector {0} did not appear on {1}, extracting anyway",
                        new Object[]{profile.waitSelector(), profile.homeUrl()});
            }
        }
        driver.settle(Duration.ofMillis(profile.settleMillis()));

        List<List<Candidate>> passes = driver.evaluate(doc -> extractor.extract(doc, profile));
        return PageLoad.loaded(navigation.httpStatus(), passes);
    }
}
