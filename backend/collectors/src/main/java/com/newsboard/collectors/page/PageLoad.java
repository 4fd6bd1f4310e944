package com.newsboard.collectors.page;

import com.newsboard.core.model.Candidate;
import com.newsboard.core.model.FailureKind;

import java.util.List;

public record PageLoad(
        boolean ok,
        FailureKind failure,
        String error,
        int httpStatus,
        List<List<Candidate>> passes
) {
    public PageLoad {
        passes = passes == null ? List.of() : List.copyOf(passes);
    }

    public static PageLoad loaded(int httpStatus, List<List<Candidate>> passes) {
        return new PageLoad(true, null, null, httpStatus, passes);
    }

    public static PageLoad failed(FailureKind failure, String error, int httpStatus) {
        return new PageLoad(false, failure, error, httpStatus, List.of());
    }
}
