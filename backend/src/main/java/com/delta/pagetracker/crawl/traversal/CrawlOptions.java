package com.delta.pagetracker.crawl.traversal;

import com.delta.pagetracker.crawl.template.WebsiteTemplate;

import java.util.ArrayList;
import java.util.List;

public record CrawlOptions(
    int maxDepth,
    int maxPages,
    List<String> includePatterns,
    List<String> excludePatterns,
    long timeoutMs,
    long delayMs,
    boolean respectRobots,
    boolean enableCredentialPrompting
) {
    public CrawlOptions {
        maxDepth = Math.max(0, maxDepth);
        maxPages = Math.max(1, maxPages);
        includePatterns = includePatterns == null ? List.of() : List.copyOf(includePatterns);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        timeoutMs = timeoutMs <= 0 ? 30_000 : timeoutMs;
        delayMs = Math.max(0, delayMs);
    }

    public static CrawlOptions forJob(
        int maxDepth,
        int maxPages,
        List<String> jobInclude,
        List<String> jobExclude,
        WebsiteTemplate template,
        boolean templateExplicit,
        long defaultDelayMs
    ) {
        List<String> include = new ArrayList<>(jobInclude == null ? List.of() : jobInclude);
        List<String> exclude = new ArrayList<>(jobExclude == null ? List.of() : jobExclude);
        if (template == null) {
            return new CrawlOptions(maxDepth, maxPages, include, exclude, 30_000, defaultDelayMs, true, false);
        }
        if (templateExplicit) {
            if (include.isEmpty()) {
                include.addAll(template.urlPatterns().include());
            }
            for (String pattern : template.urlPatterns().exclude()) {
                if (!exclude.contains(pattern)) {
                    exclude.add(pattern);
                }
            }
        }
        WebsiteTemplate.CrawlLimits limits = template.limits();
        return new CrawlOptions(
            maxDepth,
            maxPages,
            include,
            exclude,
            limits.timeoutMs(),
            limits.delayMs(),
            template.behaviors().respectRobots(),
            limits.enableCredentialPrompting()
        );
    }
}
