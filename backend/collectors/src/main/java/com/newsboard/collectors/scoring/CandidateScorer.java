package com.newsboard.collectors.scoring;

import com.newsboard.core.model.Candidate;
import com.newsboard.core.util.TextUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The first pass with a surviving candidate is used alone; later passes are never merged in.
 * Ties go to the earlier extracted candidate.
 */
public class CandidateScorer {
    static final String NO_CANDIDATES = "no candidates found";
    static final String TITLE_TOO_SHORT = "title too short";
    static final String NO_STORY_URL = "no story URL";

    private static final Comparator<ScoredCandidate> BEST_FIRST = Comparator
            .comparingDouble(ScoredCandidate::score).reversed()
            .thenComparingInt(ScoredCandidate::order);

    private final SourceProfile profile;

    public CandidateScorer(SourceProfile profile) {
        this.profile = Objects.requireNonNull(profile, "profile is required");
    }

    public ScoreResult select(List<List<Candidate>> passes) {
        return choose(passes, 1, false);
    }

    /**
     * Multi-item variant: survivors of the chosen pass, de-duplicated by normalised url (first
     * occurrence wins), best first, at most {@code limit} of them.
     */
    public ScoreResult rank(List<List<Candidate>> passes, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        return choose(passes, limit, true);
    }

    private ScoreResult choose(List<List<Candidate>> passes, int limit, boolean distinctUrls) {
        int seen = 0;
        int tooShort = 0;
        int notStory = 0;
        for (List<Candidate> pass : passes) {
            List<ScoredCandidate> survivors = new ArrayList<>();
            Set<String> urls = new HashSet<>();
            for (int i = 0; i < pass.size(); i++) {
                Candidate candidate = pass.get(i);
                seen++;
                if (candidate.title().length() < profile.minTitleLength()) {
                    tooShort++;
                    continue;
                }
                if (!profile.isStoryUrl(candidate.url())) {
                    notStory++;
                    continue;
                }
                if (distinctUrls && !urls.add(TextUtils.normalizeUrl(candidate.url()))) {
                    continue;
                }
                survivors.add(new ScoredCandidate(candidate, score(candidate), i));
            }
            if (!survivors.isEmpty()) {
                survivors.sort(BEST_FIRST);
                return ScoreResult.ok(survivors.subList(0, Math.min(limit, survivors.size())));
            }
        }
        return ScoreResult.failure(reason(seen, tooShort, notStory));
    }

    public double score(Candidate candidate) {
        double total = 0;
        for (ScoringRule rule : profile.rules()) {
            total += rule.apply(candidate);
        }
        return total;
    }

    private static String reason(int seen, int tooShort, int notStory) {
        if (seen == 0) {
            return NO_CANDIDATES;
        }
        if (tooShort == seen) {
            return TITLE_TOO_SHORT;
        }
        if (notStory == seen) {
            return NO_STORY_URL;
        }
        return "no usable candidates (" + seen + " seen, " + tooShort + " " + TITLE_TOO_SHORT + ", "
                + notStory + " " + NO_STORY_URL + ")";
    }
}
