package com.newsboard.collectors.scoring;

import com.newsboard.core.model.Candidate;

public record ScoredCandidate(Candidate candidate, double score, int order) {
}
