package com.delta.pagetracker.crawl.model;

import java.util.List;

public record CrawlResult(
    String baseUrl,
    List<ScrapedPage> pages,
    List<CrawlError> errors,
    CrawlSummary summary
) {
    public CrawlResult {
        pages = pages == null ? List.of() : List.copyOf(pages);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
