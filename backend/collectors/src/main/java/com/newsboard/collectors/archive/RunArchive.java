package com.newsboard.collectors.archive;

import com.newsboard.core.model.SourceRun;

public interface RunArchive {
    RunArchive NONE = (run, html) -> {
    };

    void archive(SourceRun run, String html);
}
