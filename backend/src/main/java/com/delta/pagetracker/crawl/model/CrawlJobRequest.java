package com.delta.pagetracker.crawl.model;

import java.util.List;

public record CrawlJobRequest(
    Long id,
    String tenantId,
    String name,
    String baseUrl,
    String schedule,
    String templateId,
    Integer maxDepth,
    Integer maxPages,
    List<String> includePatterns,
    List<String> excludePatterns,
    Long credentialId,
    Boolean active
) {
}
