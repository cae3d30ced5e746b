package com.delta.pagetracker.crawl.model;

import java.time.Instant;

public record CredentialView(
    long id,
    String tenantId,
    String name,
    String domain,
    String authKind,
    boolean active,
    Instant createdAt,
    Instant updatedAt
) {
}
