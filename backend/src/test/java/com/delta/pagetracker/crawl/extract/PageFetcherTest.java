package com.delta.pagetracker.crawl.extract;

import com.delta.pagetracker.config.CrawlerProperties;
import com.delta.pagetracker.crawl.auth.AuthConfig;
import com.delta.pagetracker.crawl.auth.AuthenticationAdapter;
import com.delta.pagetracker.crawl.auth.AuthenticationException;
import com.delta.pagetracker.crawl.auth.BrowsingContext;
import com.delta.pagetracker.crawl.auth.HtmlLoginDetector;
import com.delta.pagetracker.crawl.http.PoliteHttpClient;
import com.delta.pagetracker.crawl.model.ScrapedPage;
import com.delta.pagetracker.crawl.traversal.CrawlOptions;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageFetcherTest {
    private static final String LOGIN_PAGE = """
        <html><head><title>Sign in</title></head><body>
          <form id="login" action="/session" method="post">
            <input type="email" name="email">
            <input type="password" name="password">
            <button type="submit">Sign In</button>
          </form>
        </body></html>
        """;
    private static final String MEMBER_PAGE =
        "<html><head><title>Members</title></head><body><main><h1>Member area</h1><p>Quarterly figures</p></main></body></html>";

    private MockWebServer server;
    private ExecutorService executor;
    private AuthenticationAdapter adapter;
    private PageFetcher fetcher;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(0);
        executor = Executors.newFixedThreadPool(2);
        PoliteHttpClient httpClient = new PoliteHttpClient(properties, executor);
        adapter = new AuthenticationAdapter(httpClient);
        fetcher = new PageFetcher(httpClient, adapter, new HtmlLoginDetector(), new PageExtractor());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void fetchesAndTagsPublicPage() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setBody(MEMBER_PAGE).addHeader("Content-Type", "text/html"));
        server.start();
        String url = server.url("/open").toString();

        ScrapedPage page = fetcher.fetchAndExtract(url, 0, null, null, BrowsingContext.anonymous(), options(true));

        assertThat(page.url()).isEqualTo(url);
        assertThat(page.title()).isEqualTo("Member area");
        assertThat(page.content()).contains("Quarterly figures");
        assertThat(page.metadata().authMethod()).isEqualTo("none");
        assertThat(page.metadata().contentType()).isEqualTo("public");
    }

    @Test
    void relativeLinksResolveAgainstRedirectTarget() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if ("/docs".equals(request.getPath())) {
                    return new MockResponse().setResponseCode(301).addHeader("Location", "/docs/");
                }
                if ("/docs/".equals(request.getPath())) {
                    return new MockResponse()
                        .setBody("<html><body><main><p>Guides</p><a href=\"intro\">Intro</a></main></body></html>")
                        .addHeader("Content-Type", "text/html");
                }
                return new MockResponse().setResponseCode(404);
            }
        });
        server.start();
        String url = server.url("/docs").toString();

        ScrapedPage page = fetcher.fetchAndExtract(url, 0, null, null, BrowsingContext.anonymous(), options(true));

        assertThat(page.url()).isEqualTo(url);
        assertThat(page.metadata().links()).containsExactly(server.url("/docs/intro").toString());
    }

    @Test
    void httpErrorsBecomeFetchExceptions() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(404));
        server.start();
        String url = server.url("/missing").toString();

        assertThatThrownBy(() -> fetcher.fetchAndExtract(url, 0, null, null, BrowsingContext.anonymous(), options(true)))
            .isInstanceOfSatisfying(PageFetchException.class, e -> {
                assertThat(e.getMessage()).isEqualTo("HTTP 404");
                assertThat(e.getStatusCode()).isEqualTo(404);
            });
    }

    @Test
    void slowResponsesTimeOut() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setBody(MEMBER_PAGE).setHeadersDelay(2, TimeUnit.SECONDS));
        server.start();
        String url = server.url("/slow").toString();
        CrawlOptions options = new CrawlOptions(0, 1, List.of(), List.of(), 200, 0, false, true);

        assertThatThrownBy(() -> fetcher.fetchAndExtract(url, 0, null, null, BrowsingContext.anonymous(), options))
            .isInstanceOf(PageFetchException.class)
            .hasMessage("Timed out after 200ms");
    }

    @Test
    void loginWallWithoutCredentialAsksForOne() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setBody(LOGIN_PAGE).addHeader("Content-Type", "text/html"));
        server.start();
        String url = server.url("/members").toString();

        assertThatThrownBy(() -> fetcher.fetchAndExtract(url, 0, null, null, BrowsingContext.anonymous(), options(true)))
            .isInstanceOfSatisfying(AuthenticationException.class, e -> {
                assertThat(e.getMessage()).startsWith("Login page detected but no matching authentication configured.");
                assertThat(e.getMessage()).contains("Authentication required for " + server.getHostName() + ".");
                assertThat(e.getLoginMethod()).isEqualTo("form");
            });
    }

    @Test
    void loginWallIsIgnoredWhenPromptingDisabled() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setBody(LOGIN_PAGE).addHeader("Content-Type", "text/html"));
        server.start();
        String url = server.url("/members").toString();

        ScrapedPage page = fetcher.fetchAndExtract(url, 0, null, null, BrowsingContext.anonymous(), options(false));

        assertThat(page.title()).isEqualTo("Sign in");
    }

    @Test
    void formCredentialPassesLoginWallAndRefetchesPage() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String cookie = request.getHeader("Cookie");
                boolean signedIn = cookie != null && cookie.contains("session=ok");
                if ("POST".equals(request.getMethod()) && "/session".equals(request.getPath())) {
                    String body = request.getBody().readUtf8();
                    if (!body.contains("email=alice%40example.com") || !body.contains("password=pw")) {
                        return new MockResponse().setResponseCode(302).addHeader("Location", "/login");
                    }
                    return new MockResponse()
                        .setResponseCode(302)
                        .addHeader("Set-Cookie", "session=ok; Path=/")
                        .addHeader("Location", "/members");
                }
                if ("/members".equals(request.getPath()) && signedIn) {
                    return new MockResponse().setBody(MEMBER_PAGE).addHeader("Content-Type", "text/html");
                }
                return new MockResponse().setBody(LOGIN_PAGE).addHeader("Content-Type", "text/html");
            }
        });
        server.start();
        String url = server.url("/members").toString();
        AuthConfig.Form form = new AuthConfig.Form("alice@example.com", "pw", null, null, null, null, null);
        BrowsingContext context = adapter.prepare(form, url);

        ScrapedPage page = fetcher.fetchAndExtract(url, 0, null, null, context, options(true));

        assertThat(page.title()).isEqualTo("Member area");
        assertThat(page.metadata().authMethod()).isEqualTo("credentials");
        assertThat(page.metadata().contentType()).isEqualTo("credential-based");
        assertThat(context.formLoginPerformed()).isTrue();
    }

    private static CrawlOptions options(boolean prompting) {
        return new CrawlOptions(0, 1, List.of(), List.of(), 5_000, 0, false, prompting);
    }
}
