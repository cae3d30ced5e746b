package com.delta.pagetracker.crawl.model;

import java.time.Instant;
import java.util.List;

public record JobRun(
    long id,
    long jobId,
    String tenantId,
    RunStatus status,
    Instant startedAt,
    Instant completedAt,
    int urlsProcessed,
    int urlsSuccessful,
    int urlsFailed,
    int documentsCreated,
    int documentsUpdated,
    int changesDetected,
    String errorMessage,
    List<CrawlError> logs
) {
    public JobRun {
        logs = logs == null ? List.of() : List.copyOf(logs);
    }
}
