package com.newsboard.service.config;

import com.newsboard.service.retention.RetentionPolicy;
import com.newsboard.service.write.WritePolicy;

import java.time.Duration;

public record PipelineConfig(
        String dataDir,
        int top10HistoryLimit,
        Duration navigationTimeout,
        Duration waitTimeout,
        Duration storeTimeout,
        String objectPrefix,
        Duration signedUrlTtl,
        WritePolicy write,
        RetentionPolicy retention,
        String archiveDir
) {
    public static final PipelineConfig DEFAULT =
            new PipelineConfig(null, 0, null, null, null, null, null, null, null, null);

    public PipelineConfig {
        dataDir = dataDir == null || dataDir.isBlank() ? "data" : dataDir;
        top10HistoryLimit = top10HistoryLimit <= 0 ? 48 : top10HistoryLimit;
        navigationTimeout = navigationTimeout == null ? Duration.ofSeconds(45) : navigationTimeout;
        waitTimeout = waitTimeout == null ? Duration.ofSeconds(25) : waitTimeout;
        storeTimeout = storeTimeout == null ? Duration.ofSeconds(20) : storeTimeout;
        objectPrefix = objectPrefix == null ? "screenshots" : objectPrefix;
        signedUrlTtl = signedUrlTtl == null ? Duration.ofHours(12) : signedUrlTtl;
        write = write == null ? WritePolicy.DEFAULT : write;
        retention = retention == null ? RetentionPolicy.DEFAULT : retention;
        archiveDir = archiveDir == null || archiveDir.isBlank() ? dataDir + "/archive" : archiveDir;
    }
}
