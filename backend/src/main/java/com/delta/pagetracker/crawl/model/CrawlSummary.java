package com.delta.pagetracker.crawl.model;

import java.time.Instant;

public record CrawlSummary(
    int totalPages,
    int successfulPages,
    int failedPages,
    Instant startTime,
    Instant endTime,
    long durationMs,
    AuthenticationAttempts authenticationAttempts,
    boolean cancelled
) {
}
