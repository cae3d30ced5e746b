package com.delta.pagetracker.crawl.model;

import java.time.Instant;

public record VersionedDocument(
    long id,
    String tenantId,
    Long jobId,
    String url,
    String parentUrl,
    String title,
    String content,
    String contentHash,
    PageMetadata metadata,
    int version,
    int depth,
    boolean active,
    boolean embedded,
    Instant createdAt,
    Instant updatedAt
) {
}
