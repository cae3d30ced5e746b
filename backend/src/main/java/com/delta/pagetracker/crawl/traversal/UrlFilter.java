package com.delta.pagetracker.crawl.traversal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class UrlFilter {
    private static final Logger log = LoggerFactory.getLogger(UrlFilter.class);

    private final String seedUrl;
    private final List<Pattern> include;
    private final List<Pattern> exclude;
    private final boolean includeAll;

    public UrlFilter(String seedUrl, List<String> includePatterns, List<String> excludePatterns) {
        this.seedUrl = seedUrl;
        List<String> includes = includePatterns == null ? List.of() : includePatterns;
        this.includeAll = includes.isEmpty() || includes.stream().anyMatch(p -> p != null && p.trim().equals("*"));
        this.include = includeAll ? List.of() : compileAll(includes);
        this.exclude = compileAll(excludePatterns == null ? List.of() : excludePatterns);
    }

    public boolean accepts(String url) {
        if (url == null || !UrlNormalizer.isSameSite(seedUrl, url)) {
            return false;
        }
        if (matchesAny(exclude, url)) {
            return false;
        }
        if (url.equals(seedUrl) || includeAll) {
            return true;
        }
        return matchesAny(include, url);
    }

    public static void validate(List<String> patterns) {
        if (patterns == null) {
            return;
        }
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                throw new IllegalArgumentException("URL pattern must not be blank");
            }
            if (pattern.trim().equals("*")) {
                continue;
            }
            Pattern.compile(pattern);
        }
    }

    private static List<Pattern> compileAll(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank() || pattern.trim().equals("*")) {
                continue;
            }
            try {
                compiled.add(Pattern.compile(pattern));
            } catch (PatternSyntaxException e) {
                log.warn("Invalid URL pattern '{}', matching it literally", pattern);
                compiled.add(Pattern.compile(Pattern.quote(pattern)));
            }
        }
        return compiled;
    }

    private static boolean matchesAny(List<Pattern> patterns, String url) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(url).find()) {
                return true;
            }
        }
        return false;
    }
}
