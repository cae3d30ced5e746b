package com.delta.pagetracker.crawl.template;

import java.util.List;

public record WebsiteTemplate(
    String id,
    String name,
    String description,
    TemplateCategory category,
    CrawlLimits limits,
    Selectors selectors,
    UrlPatterns urlPatterns,
    MetadataFlags metadata,
    Behaviors behaviors
) {
    public record CrawlLimits(
        int maxDepth,
        int maxPages,
        long timeoutMs,
        long delayMs,
        boolean enableCredentialPrompting
    ) {
    }

    public record Selectors(
        List<String> contentPriority,
        List<String> excludeElements,
        List<String> linkPatterns,
        List<String> titleSelectors,
        List<String> descriptionSelectors
    ) {
        public Selectors {
            contentPriority = List.copyOf(contentPriority);
            excludeElements = List.copyOf(excludeElements);
            linkPatterns = List.copyOf(linkPatterns);
            titleSelectors = List.copyOf(titleSelectors);
            descriptionSelectors = List.copyOf(descriptionSelectors);
        }
    }

    public record UrlPatterns(List<String> include, List<String> exclude, List<String> followPatterns) {
        public UrlPatterns {
            include = List.copyOf(include);
            exclude = List.copyOf(exclude);
            followPatterns = List.copyOf(followPatterns);
        }
    }

    public record MetadataFlags(
        boolean detectArticles,
        boolean extractAuthors,
        boolean extractDates,
        boolean extractCategories,
        boolean extractTags
    ) {
    }

    public record Behaviors(
        boolean respectRobots,
        boolean retryFailedPages,
        boolean skipDuplicateContent,
        boolean extractImages,
        boolean extractDownloads
    ) {
    }
}
