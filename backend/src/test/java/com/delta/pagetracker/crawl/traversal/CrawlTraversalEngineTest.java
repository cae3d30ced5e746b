package com.delta.pagetracker.crawl.traversal;

import com.delta.pagetracker.crawl.auth.AuthConfig;
import com.delta.pagetracker.crawl.auth.AuthenticationAdapter;
import com.delta.pagetracker.crawl.auth.AuthenticationException;
import com.delta.pagetracker.crawl.extract.PageFetchException;
import com.delta.pagetracker.crawl.extract.PageFetcher;
import com.delta.pagetracker.crawl.http.PoliteHttpClient;
import com.delta.pagetracker.crawl.model.CrawlError;
import com.delta.pagetracker.crawl.model.CrawlResult;
import com.delta.pagetracker.crawl.model.PageMetadata;
import com.delta.pagetracker.crawl.model.ScrapedPage;
import com.delta.pagetracker.crawl.robots.RobotsTxtService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CrawlTraversalEngineTest {
    private PageFetcher fetcher;
    private RobotsTxtService robots;
    private CrawlTraversalEngine engine;
    private final Map<String, List<String>> linkGraph = new HashMap<>();

    @BeforeEach
    void setUp() {
        fetcher = Mockito.mock(PageFetcher.class);
        robots = Mockito.mock(RobotsTxtService.class);
        AuthenticationAdapter adapter = new AuthenticationAdapter(Mockito.mock(PoliteHttpClient.class));
        engine = new CrawlTraversalEngine(fetcher, adapter, robots);
        when(fetcher.fetchAndExtract(anyString(), anyInt(), any(), any(), any(), any()))
            .thenAnswer(invocation -> page(invocation.getArgument(0), invocation.getArgument(1)));
    }

    @Test
    void breadthFirstWalkRespectsDepthAndVisitsEachUrlOnce() {
        linkGraph.put("https://example.com/", List.of("https://example.com/a", "https://example.com/b", "https://other.com/x"));
        linkGraph.put("https://example.com/a", List.of("https://example.com/", "https://example.com/b#section"));
        linkGraph.put("https://example.com/b", List.of("https://example.com/c"));

        CrawlResult result = engine.crawl("https://example.com", options(1, 100), null);

        assertThat(result.pages()).extracting(ScrapedPage::url)
            .containsExactly("https://example.com/", "https://example.com/a", "https://example.com/b");
        assertThat(result.errors()).isEmpty();
        assertThat(result.summary().totalPages()).isEqualTo(3);
        assertThat(result.summary().successfulPages()).isEqualTo(3);
        assertThat(result.summary().cancelled()).isFalse();
        verify(fetcher, never()).fetchAndExtract(eq("https://example.com/c"), anyInt(), any(), any(), any(), any());
        verify(fetcher, never()).fetchAndExtract(eq("https://other.com/x"), anyInt(), any(), any(), any(), any());
    }

    @Test
    void cyclicLinksTerminate() {
        linkGraph.put("https://example.com/", List.of("https://example.com/a"));
        linkGraph.put("https://example.com/a", List.of("https://example.com/", "https://example.com/a/"));

        CrawlResult result = engine.crawl("https://example.com/", options(10, 100), null);

        assertThat(result.pages()).hasSize(2);
        verify(fetcher, times(1)).fetchAndExtract(eq("https://example.com/a"), anyInt(), any(), any(), any(), any());
    }

    @Test
    void stopsAtMaxPages() {
        linkGraph.put("https://example.com/", List.of(
            "https://example.com/1", "https://example.com/2", "https://example.com/3", "https://example.com/4"));

        CrawlResult result = engine.crawl("https://example.com/", options(2, 2), null);

        assertThat(result.pages()).hasSize(2);
    }

    @Test
    void depthZeroFetchesOnlyTheSeed() {
        linkGraph.put("https://example.com/", List.of("https://example.com/a"));

        CrawlResult result = engine.crawl("https://example.com/", options(0, 100), null);

        assertThat(result.pages()).extracting(ScrapedPage::url).containsExactly("https://example.com/");
    }

    @Test
    void includePatternsRestrictChildrenButNotSeed() {
        linkGraph.put("https://example.com/", List.of("https://example.com/docs/intro", "https://example.com/blog/news"));
        CrawlOptions options = new CrawlOptions(2, 100, List.of("/docs/"), List.of(), 5_000, 0, false, false);

        CrawlResult result = engine.crawl("https://example.com/", options, null);

        assertThat(result.pages()).extracting(ScrapedPage::url)
            .containsExactly("https://example.com/", "https://example.com/docs/intro");
    }

    @Test
    void fetchFailuresAreRecordedAndCrawlContinues() {
        linkGraph.put("https://example.com/", List.of("https://example.com/broken", "https://example.com/ok"));
        when(fetcher.fetchAndExtract(eq("https://example.com/broken"), anyInt(), any(), any(), any(), any()))
            .thenThrow(new PageFetchException("https://example.com/broken", 500, "HTTP_5XX", "HTTP 500"));

        CrawlResult result = engine.crawl("https://example.com/", options(1, 100), null);

        assertThat(result.pages()).extracting(ScrapedPage::url)
            .containsExactly("https://example.com/", "https://example.com/ok");
        assertThat(result.errors()).containsExactly(CrawlError.of("https://example.com/broken", "HTTP 500"));
        assertThat(result.summary().totalPages()).isEqualTo(3);
        assertThat(result.summary().failedPages()).isEqualTo(1);
    }

    @Test
    void loginWallsCountAsFailedAuthentication() {
        linkGraph.put("https://example.com/", List.of("https://example.com/members"));
        when(fetcher.fetchAndExtract(eq("https://example.com/members"), anyInt(), any(), any(), any(), any()))
            .thenThrow(new AuthenticationException("Login page detected but no matching authentication configured.", "form"));

        CrawlResult result = engine.crawl("https://example.com/", options(1, 100), null);

        assertThat(result.errors()).hasSize(1);
        CrawlError error = result.errors().get(0);
        assertThat(error.needsCredentials()).isTrue();
        assertThat(error.loginMethod()).isEqualTo("form");
        assertThat(error.error()).contains("This website requires authentication.");
        assertThat(result.summary().authenticationAttempts().failed()).isEqualTo(1);
    }

    @Test
    void robotsBlockedUrlsBecomeErrorsWithoutFetching() {
        linkGraph.put("https://example.com/", List.of("https://example.com/private"));
        when(robots.isAllowed(anyString())).thenReturn(true);
        when(robots.isAllowed("https://example.com/private")).thenReturn(false);
        CrawlOptions options = new CrawlOptions(1, 100, List.of(), List.of(), 5_000, 0, true, false);

        CrawlResult result = engine.crawl("https://example.com/", options, null);

        assertThat(result.pages()).hasSize(1);
        assertThat(result.errors()).containsExactly(CrawlError.of("https://example.com/private", "Blocked by robots.txt"));
        verify(fetcher, never()).fetchAndExtract(eq("https://example.com/private"), anyInt(), any(), any(), any(), any());
    }

    @Test
    void internalDomainWithoutCredentialIsNotFetched() {
        CrawlResult result = engine.crawl("https://wiki.company.com/home", options(2, 10), null);

        assertThat(result.pages()).isEmpty();
        assertThat(result.errors()).hasSize(1);
        CrawlError error = result.errors().get(0);
        assertThat(error.error()).startsWith("Internal domain detected: wiki.company.com.");
        assertThat(error.needsCredentials()).isTrue();
        assertThat(error.loginMethod()).isEqualTo("cookie");
        assertThat(result.summary().authenticationAttempts().failed()).isEqualTo(1);
        verify(fetcher, never()).fetchAndExtract(anyString(), anyInt(), any(), any(), any(), any());
    }

    @Test
    void internalDomainWithCredentialIsCrawled() {
        AuthConfig cookie = new AuthConfig.Cookie(List.of(new AuthConfig.CookieEntry("sid", "abc", null, null)));

        CrawlResult result = engine.crawl("https://wiki.company.com/home", options(0, 10), null, cookie,
            CrawlCancellation.none());

        assertThat(result.pages()).hasSize(1);
        assertThat(result.summary().authenticationAttempts().credentials()).isEqualTo(1);
    }

    @Test
    void invalidBaseUrlYieldsSingleError() {
        CrawlResult result = engine.crawl("not a url", options(1, 10), null);

        assertThat(result.pages()).isEmpty();
        assertThat(result.errors()).extracting(CrawlError::error).containsExactly("Invalid base URL: not a url");
    }

    @Test
    void cancelledRunStopsBeforeFetching() {
        CrawlCancellation cancellation = new CrawlCancellation();
        cancellation.cancel();

        CrawlResult result = engine.crawl("https://example.com/", options(1, 10), null, null, cancellation);

        assertThat(result.summary().cancelled()).isTrue();
        assertThat(result.pages()).isEmpty();
    }

    private static CrawlOptions options(int maxDepth, int maxPages) {
        return new CrawlOptions(maxDepth, maxPages, List.of(), List.of(), 5_000, 0, false, false);
    }

    private ScrapedPage page(String url, int depth) {
        PageMetadata metadata = new PageMetadata("example.com", linkGraph.getOrDefault(url, List.of()), null, null,
            null, null, null, null, null, null, 3, 1, depth, null, "public", "none");
        return new ScrapedPage(url, "Title", "content for " + url, "hash-" + url, metadata, Instant.now());
    }
}
