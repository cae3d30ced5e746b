package com.delta.pagetracker.crawl.model;

import java.time.Instant;

public record ScrapedPage(
    String url,
    String title,
    String content,
    String contentHash,
    PageMetadata metadata,
    Instant fetchedAt
) {
    public int depth() {
        return metadata == null ? 0 : metadata.depth();
    }
}
