package com.delta.pagetracker.crawl.model;

import java.time.Instant;

public record ChangeRecord(
    long id,
    String tenantId,
    long documentId,
    Long jobRunId,
    ChangeType changeType,
    String oldContentHash,
    String newContentHash,
    Double changePercentage,
    String summary,
    Instant detectedAt
) {
}
