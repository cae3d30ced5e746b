package com.delta.pagetracker.crawl.robots;

import com.delta.pagetracker.config.CrawlerProperties;
import com.delta.pagetracker.crawl.http.PoliteHttpClient;
import com.delta.pagetracker.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);
    private static final Duration CACHE_TTL = Duration.ofHours(6);

    private final CrawlerProperties properties;
    private final PoliteHttpClient httpClient;
    private final Map<String, CachedRules> cache = new ConcurrentHashMap<>();

    public RobotsTxtService(CrawlerProperties properties, PoliteHttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    public boolean isAllowed(String url) {
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return true;
        }
        RobotsRules rules = getRulesForOrigin(uri);
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return rules.isAllowed(path);
    }

    public Long crawlDelayMs(String url) {
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return null;
        }
        return getRulesForOrigin(uri).getCrawlDelayMs();
    }

    RobotsRules getRulesForOrigin(URI uri) {
        String origin = uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getRawAuthority().toLowerCase(Locale.ROOT);
        Instant now = Instant.now();
        CachedRules cached = cache.get(origin);
        if (cached != null && cached.loadedAt().plus(CACHE_TTL).isAfter(now)) {
            return cached.rules();
        }
        RobotsRules rules = loadRules(origin);
        cache.put(origin, new CachedRules(rules, now));
        return rules;
    }

    private RobotsRules loadRules(String origin) {
        String robotsUrl = origin + "/robots.txt";
        HttpFetchResult fetch = httpClient.get(robotsUrl, "text/plain,text/*;q=0.9,*/*;q=0.1");
        if (fetch.statusCode() >= 400 && fetch.statusCode() < 500) {
            log.debug("No robots.txt at {} status={}", origin, fetch.statusCode());
            return RobotsRules.allowAll();
        }
        if (!fetch.isSuccessful()) {
            boolean failOpen = properties.getRobots().isFailOpen();
            log.warn(
                "robots fetch failed origin={} status={} errorCode={} decision={}",
                origin,
                fetch.statusCode(),
                fetch.errorCode(),
                failOpen ? "allow_all" : "disallow_all"
            );
            return failOpen ? RobotsRules.allowAll() : RobotsRules.disallowAll();
        }
        return RobotsRules.parse(fetch.body(), agentToken());
    }

    private String agentToken() {
        String userAgent = properties.getUserAgent();
        int slash = userAgent.indexOf('/');
        String token = slash > 0 ? userAgent.substring(0, slash) : userAgent.split("\\s+")[0];
        return token.toLowerCase(Locale.ROOT);
    }

    private URI toUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private record CachedRules(RobotsRules rules, Instant loadedAt) {
    }
}
