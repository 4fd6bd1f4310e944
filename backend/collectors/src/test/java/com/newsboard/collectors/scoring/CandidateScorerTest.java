package com.newsboard.collectors.scoring;

import com.newsboard.collectors.support.Profiles;
import com.newsboard.core.model.Candidate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CandidateScorerTest {
    private static final String HOME = "https://www.example.com/";
    private final CandidateScorer scorer = new CandidateScorer(Profiles.newsSite("cbs1", HOME));

    @Test
    void highestScoreWins() {
        Candidate plain = candidate("A plain secondary story headline", "/news/plain", Map.of("inMain", true));
        Candidate lead = candidate("The lead story with an h1 heading", "/news/lead", Map.of("hasH1", true, "inMain", true));

        ScoreResult result = scorer.select(List.of(List.of(plain, lead)));

        assertTrue(result.ok());
        assertEquals(lead, result.winner().orElseThrow().candidate());
        assertEquals(120.0, result.winner().orElseThrow().score());
    }

    @Test
    void tiesGoToEarlierExtraction() {
        Candidate first = candidate("First story of equal weight here", "/news/first", Map.of());
        Candidate second = candidate("Second story of equal weight here", "/news/second", Map.of());

        ScoreResult result = scorer.select(List.of(List.of(first, second)));

        assertEquals(first, result.winner().orElseThrow().candidate());
    }

    @Test
    void negativeSignalDemotesCandidate() {
        Candidate gallery = candidate("Gallery of the week in pictures", "/news/pictures/1",
                Map.of("hasH1", true, "isGallery", true));
        Candidate story = candidate("Ordinary story headline text here", "/news/story", Map.of());

        assertEquals(story, scorer.select(List.of(List.of(gallery, story))).winner().orElseThrow().candidate());
    }

    @Test
    void firstPassWithSurvivorsIsUsedExclusively() {
        Candidate rejected = candidate("Too short", "/news/short", Map.of("hasH1", true));
        Candidate fallback = candidate("Fallback pass story headline", "/news/fallback", Map.of());
        Candidate strongerLater = candidate("Stronger story in the last pass", "/news/stronger", Map.of("hasH1", true));

        ScoreResult result = scorer.select(List.of(List.of(rejected), List.of(fallback), List.of(strongerLater)));

        assertEquals(fallback, result.winner().orElseThrow().candidate());
        assertEquals(1, result.ranked().size());
    }

    @Test
    void absenceIsReportedWithReason() {
        assertEquals(CandidateScorer.NO_CANDIDATES, scorer.select(List.of(List.of(), List.of())).reason());

        ScoreResult tooShort = scorer.select(List.of(List.of(candidate("Short", "/news/a", Map.of()))));
        assertFalse(tooShort.ok());
        assertEquals(CandidateScorer.TITLE_TOO_SHORT, tooShort.reason());

        ScoreResult noStory = scorer.select(List.of(List.of(
                candidate("A long enough video headline here", "/video/clip", Map.of()))));
        assertEquals(CandidateScorer.NO_STORY_URL, noStory.reason());

        ScoreResult mixed = scorer.select(List.of(List.of(
                candidate("Short", "/news/a", Map.of()),
                candidate("A long enough video headline here", "/video/clip", Map.of()))));
        assertTrue(mixed.reason().contains("1 title too short"));
        assertTrue(mixed.reason().contains("1 no story URL"));
    }

    @Test
    void rankDeduplicatesByNormalisedUrlAndTruncates() {
        Candidate a = candidate("Story A headline long enough", "/news/a?utm_source=x", Map.of());
        Candidate aAgain = candidate("Story A teaser with picture", "/news/a", Map.of("hasH1", true));
        Candidate b = candidate("Story B headline long enough", "/news/b", Map.of("hasImage", true));
        Candidate c = candidate("Story C headline long enough", "/news/c", Map.of());

        ScoreResult result = scorer.rank(List.of(List.of(a, aAgain, b, c)), 2);

        assertEquals(List.of(b, a), result.ranked().stream().map(ScoredCandidate::candidate).toList());
    }

    @Test
    void numericRuleAppliesWithinRange() {
        ScoringRule rule = ScoringRule.range("titleLength", 15, 20.0, 220.0);

        assertEquals(15.0, rule.apply(new Candidate("t", "u", null, Map.of("titleLength", 20))));
        assertEquals(0.0, rule.apply(new Candidate("t", "u", null, Map.of("titleLength", 19))));
        assertEquals(0.0, rule.apply(new Candidate("t", "u", null, Map.of())));
    }

    private static Candidate candidate(String title, String path, Map<String, Object> signals) {
        return new Candidate(title, HOME + path.substring(1), null, signals);
    }
}
