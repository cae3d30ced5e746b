package com.delta.pagetracker.crawl.model;

import java.time.Instant;
import java.util.List;

public record CrawlJob(
    long id,
    String tenantId,
    String name,
    String baseUrl,
    String schedule,
    String templateId,
    int maxDepth,
    Integer maxPages,
    List<String> includePatterns,
    List<String> excludePatterns,
    Long credentialId,
    boolean active,
    JobStatus status,
    Instant lastRun,
    Instant nextRun,
    Instant createdAt,
    Instant updatedAt
) {
    public CrawlJob {
        includePatterns = includePatterns == null ? List.of() : List.copyOf(includePatterns);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }
}
