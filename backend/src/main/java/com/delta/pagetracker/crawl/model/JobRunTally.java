package com.delta.pagetracker.crawl.model;

public record JobRunTally(
    int urlsProcessed,
    int urlsSuccessful,
    int urlsFailed,
    int documentsCreated,
    int documentsUpdated,
    int changesDetected
) {
}
