package com.delta.pagetracker.crawl.traversal;

import com.delta.pagetracker.crawl.auth.AuthConfig;
import com.delta.pagetracker.crawl.auth.AuthErrorAssessment;
import com.delta.pagetracker.crawl.auth.AuthErrorClassifier;
import com.delta.pagetracker.crawl.auth.AuthKind;
import com.delta.pagetracker.crawl.auth.AuthenticationAdapter;
import com.delta.pagetracker.crawl.auth.AuthenticationException;
import com.delta.pagetracker.crawl.auth.BrowsingContext;
import com.delta.pagetracker.crawl.auth.DomainRules;
import com.delta.pagetracker.crawl.auth.LoginMethod;
import com.delta.pagetracker.crawl.extract.PageFetchException;
import com.delta.pagetracker.crawl.extract.PageFetcher;
import com.delta.pagetracker.crawl.model.AuthenticationAttempts;
import com.delta.pagetracker.crawl.model.CrawlError;
import com.delta.pagetracker.crawl.model.CrawlResult;
import com.delta.pagetracker.crawl.model.CrawlSummary;
import com.delta.pagetracker.crawl.model.ScrapedPage;
import com.delta.pagetracker.crawl.robots.RobotsTxtService;
import com.delta.pagetracker.crawl.template.WebsiteTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Breadth-first walk of one site. A URL lands in at most one of the visited or failed sets, which
 * bounds the walk on cyclic link graphs; fetches are strictly sequential.
 */
@Service
public class CrawlTraversalEngine {
    private static final Logger log = LoggerFactory.getLogger(CrawlTraversalEngine.class);

    private final PageFetcher pageFetcher;
    private final AuthenticationAdapter authenticationAdapter;
    private final RobotsTxtService robotsTxtService;
    private final Clock clock;

    @Autowired
    public CrawlTraversalEngine(
        PageFetcher pageFetcher,
        AuthenticationAdapter authenticationAdapter,
        RobotsTxtService robotsTxtService
    ) {
        this(pageFetcher, authenticationAdapter, robotsTxtService, Clock.systemUTC());
    }

    CrawlTraversalEngine(
        PageFetcher pageFetcher,
        AuthenticationAdapter authenticationAdapter,
        RobotsTxtService robotsTxtService,
        Clock clock
    ) {
        this.pageFetcher = pageFetcher;
        this.authenticationAdapter = authenticationAdapter;
        this.robotsTxtService = robotsTxtService;
        this.clock = clock;
    }

    public CrawlResult crawl(String baseUrl, CrawlOptions options, WebsiteTemplate template) {
        return crawl(baseUrl, options, template, null, CrawlCancellation.none());
    }

    public CrawlResult crawl(
        String baseUrl,
        CrawlOptions options,
        WebsiteTemplate template,
        AuthConfig authConfig,
        CrawlCancellation cancellation
    ) {
        Instant startTime = clock.instant();
        CrawlCancellation token = cancellation == null ? CrawlCancellation.none() : cancellation;
        String seed = UrlNormalizer.normalize(baseUrl);
        if (seed == null) {
            CrawlError error = CrawlError.of(baseUrl, "Invalid base URL: " + baseUrl);
            return result(baseUrl, List.of(), List.of(error), startTime, AuthenticationAttempts.none(), false);
        }
        if (authConfig == null && DomainRules.isInternalDomain(seed)) {
            return internalDomainShortCircuit(baseUrl, startTime);
        }

        BrowsingContext context = authenticationAdapter.prepare(authConfig, seed);
        int ssoAttempts = context.authKind() == AuthKind.SSO ? 1 : 0;
        int credentialAttempts = context.hasCredential() && context.authKind() != AuthKind.SSO ? 1 : 0;
        int failedAuth = 0;

        UrlFilter filter = new UrlFilter(seed, options.includePatterns(), options.excludePatterns());
        Deque<QueueEntry> queue = new ArrayDeque<>();
        Set<String> queued = new HashSet<>();
        Set<String> visited = new HashSet<>();
        Set<String> failed = new HashSet<>();
        List<ScrapedPage> pages = new ArrayList<>();
        List<CrawlError> errors = new ArrayList<>();
        queue.add(new QueueEntry(seed, 0, null));
        queued.add(UrlNormalizer.dedupKey(seed));

        log.info("Starting crawl of {} maxDepth={} maxPages={} auth={}",
            seed, options.maxDepth(), options.maxPages(), context.authMethod());

        int processed = 0;
        boolean cancelled = false;
        while (!queue.isEmpty() && processed < options.maxPages()) {
            if (token.isCancelled()) {
                cancelled = true;
                break;
            }
            QueueEntry entry = queue.poll();
            String url = entry.url();
            String key = UrlNormalizer.dedupKey(url);
            if (visited.contains(key) || failed.contains(key)) {
                continue;
            }
            if (entry.depth() > options.maxDepth()) {
                continue;
            }
            if (!filter.accepts(url)) {
                log.debug("Skipping {} (outside origin or filtered by patterns)", url);
                continue;
            }
            if (options.respectRobots() && !robotsTxtService.isAllowed(url)) {
                log.info("Skipping {} (blocked by robots.txt)", url);
                errors.add(CrawlError.of(url, "Blocked by robots.txt"));
                failed.add(key);
                continue;
            }
            if (processed > 0 && token.awaitDelay(effectiveDelay(url, options))) {
                cancelled = true;
                break;
            }
            processed++;

            try {
                ScrapedPage page = pageFetcher.fetchAndExtract(
                    url, entry.depth(), entry.parentUrl(), template, context, options);
                pages.add(page);
                visited.add(key);
                if (entry.depth() < options.maxDepth()) {
                    enqueueChildren(page, seed, entry.depth() + 1, queue, queued, visited, failed);
                }
            } catch (AuthenticationException e) {
                CrawlError error = analyzeError(url, e.getMessage(), e.getLoginMethod(), options);
                log.warn("Auth failure url={} error={}", url, e.getMessage());
                errors.add(error);
                failed.add(key);
                if (Boolean.TRUE.equals(error.needsCredentials())) {
                    failedAuth++;
                }
            } catch (PageFetchException e) {
                CrawlError error = analyzeError(url, e.getMessage(), null, options);
                log.warn("Fetch failure url={} reason={} error={}", url, e.getReasonCode(), e.getMessage());
                errors.add(error);
                failed.add(key);
                if (Boolean.TRUE.equals(error.needsCredentials())) {
                    failedAuth++;
                }
            } catch (RuntimeException e) {
                log.warn("Unexpected failure processing url={}", url, e);
                errors.add(CrawlError.of(url, "Processing failed: " + e.getMessage()));
                failed.add(key);
            }
        }

        if (cancelled) {
            log.info("Crawl of {} cancelled after {} pages", seed, processed);
        }
        AuthenticationAttempts attempts = new AuthenticationAttempts(ssoAttempts, credentialAttempts, failedAuth);
        CrawlResult result = result(baseUrl, pages, errors, startTime, attempts, cancelled);
        log.info("Crawl complete base={} pages={} errors={} durationMs={}",
            seed, pages.size(), errors.size(), result.summary().durationMs());
        return result;
    }

    CrawlError analyzeError(String url, String message, String loginMethodHint, CrawlOptions options) {
        AuthErrorAssessment assessment = authenticationAdapter.classifyError(url, message);
        if (!assessment.authError()) {
            return CrawlError.of(url, message);
        }
        StringBuilder text = new StringBuilder(message);
        if (assessment.suggestion() != null) {
            text.append("\n\n").append(assessment.suggestion());
        }
        String loginMethod = loginMethodHint != null ? loginMethodHint : assessment.loginMethod();
        if (assessment.needsCredentials()
            && options.enableCredentialPrompting()
            && DomainRules.isExternalCredentialSite(url)
            && loginMethodHint == null) {
            text.append("\n\n").append(AuthErrorClassifier.credentialPrompt(DomainRules.hostOf(url), LoginMethod.FORM.value()));
            loginMethod = LoginMethod.FORM.value();
        }
        return new CrawlError(url, text.toString(), assessment.needsCredentials(), loginMethod);
    }

    private CrawlResult internalDomainShortCircuit(String baseUrl, Instant startTime) {
        String host = DomainRules.hostOf(baseUrl);
        log.warn("Internal domain {} has no credential configured; skipping crawl", host);
        CrawlError error = new CrawlError(
            baseUrl,
            "Internal domain detected: " + host + ". Authentication required but no credentials configured.\n\n"
                + DomainRules.internalPlatformHint(host) + ".\n\n"
                + "Please configure credentials in the Credentials Manager.",
            true,
            "cookie"
        );
        return result(baseUrl, List.of(), List.of(error), startTime, new AuthenticationAttempts(0, 0, 1), false);
    }

    private void enqueueChildren(
        ScrapedPage page,
        String seed,
        int childDepth,
        Deque<QueueEntry> queue,
        Set<String> queued,
        Set<String> visited,
        Set<String> failed
    ) {
        for (String link : page.metadata().links()) {
            String child = UrlNormalizer.normalize(link);
            if (child == null || !UrlNormalizer.isSameSite(seed, child)) {
                continue;
            }
            String key = UrlNormalizer.dedupKey(child);
            if (visited.contains(key) || failed.contains(key) || !queued.add(key)) {
                continue;
            }
            queue.add(new QueueEntry(child, childDepth, page.url()));
        }
    }

    private long effectiveDelay(String url, CrawlOptions options) {
        long delay = options.delayMs();
        if (options.respectRobots()) {
            Long robotsDelay = robotsTxtService.crawlDelayMs(url);
            if (robotsDelay != null) {
                delay = Math.max(delay, robotsDelay);
            }
        }
        return delay;
    }

    private CrawlResult result(
        String baseUrl,
        List<ScrapedPage> pages,
        List<CrawlError> errors,
        Instant startTime,
        AuthenticationAttempts attempts,
        boolean cancelled
    ) {
        Instant endTime = clock.instant();
        CrawlSummary summary = new CrawlSummary(
            pages.size() + errors.size(),
            pages.size(),
            errors.size(),
            startTime,
            endTime,
            Duration.between(startTime, endTime).toMillis(),
            attempts,
            cancelled
        );
        return new CrawlResult(baseUrl, pages, errors, summary);
    }

    private record QueueEntry(String url, int depth, String parentUrl) {
    }
}
