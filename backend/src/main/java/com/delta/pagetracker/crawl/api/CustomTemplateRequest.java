package com.delta.pagetracker.crawl.api;

import java.util.List;

public record CustomTemplateRequest(
    String name,
    Integer maxDepth,
    Integer maxPages,
    List<String> includePatterns,
    List<String> excludePatterns
) {
}
