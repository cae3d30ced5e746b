package com.delta.pagetracker.crawl.auth;

import com.delta.pagetracker.config.CrawlerProperties;
import com.delta.pagetracker.crawl.http.PoliteHttpClient;
import com.delta.pagetracker.crawl.model.HttpFetchResult;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthenticationAdapterTest {
    private static final String LOGIN_PAGE = """
        <html><head><title>Sign in</title></head><body>
          <form id="login" action="/session" method="post">
            <input type="hidden" name="csrf" value="token-1">
            <input type="text" name="username">
            <input type="password" name="password">
            <button type="submit">Sign In</button>
          </form>
        </body></html>
        """;

    private MockWebServer server;
    private ExecutorService executor;
    private AuthenticationAdapter adapter;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(0);
        executor = Executors.newFixedThreadPool(2);
        adapter = new AuthenticationAdapter(new PoliteHttpClient(properties, executor));
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
    void cookieCredentialIsSentAsCookieHeader() {
        AuthConfig cookie = new AuthConfig.Cookie(List.of(new AuthConfig.CookieEntry("sid", "abc", null, null)));

        BrowsingContext context = adapter.prepare(cookie, "https://intranet.company.com/home");

        assertThat(context.authKind()).isEqualTo(AuthKind.COOKIE);
        assertThat(context.authMethod()).isEqualTo("credentials");
        assertThat(context.cookieHeader(URI.create("https://intranet.company.com/docs/page"))).isEqualTo("sid=abc");
        assertThat(context.cookieHeader(URI.create("https://elsewhere.com/"))).isNull();
    }

    @Test
    void basicAndHeaderCredentialsBecomeRequestHeaders() {
        BrowsingContext basic = adapter.prepare(new AuthConfig.Basic("alice", "s3cret"), "https://example.com/");
        assertThat(basic.headers()).containsEntry("Authorization", "Basic YWxpY2U6czNjcmV0");

        BrowsingContext header = adapter.prepare(
            new AuthConfig.Header(Map.of("X-Api-Key", "k-123")), "https://example.com/");
        assertThat(header.requestHeaders(URI.create("https://example.com/a"))).containsEntry("X-Api-Key", "k-123");
    }

    @Test
    void ssoCredentialIsAcceptedButMarkedUnsupported() {
        BrowsingContext context = adapter.prepare(new AuthConfig.Sso("okta", "token"), "https://intranet.company.com/");

        assertThat(context.authKind()).isEqualTo(AuthKind.SSO);
        assertThat(context.authMethod()).isEqualTo("sso");
        assertThat(context.isUnsupported()).isTrue();
        assertThat(context.unsupportedReason()).isEqualTo(AuthenticationAdapter.SSO_UNSUPPORTED);
        assertThat(context.headers()).isEmpty();
    }

    @Test
    void anonymousContextCarriesNothing() {
        BrowsingContext context = adapter.prepare(null, "https://example.com/");

        assertThat(context.hasCredential()).isFalse();
        assertThat(context.authMethod()).isEqualTo("none");
        assertThat(context.requestHeaders(URI.create("https://example.com/"))).isEmpty();
    }

    @Test
    void formLoginKeepsSessionCookieAcrossRedirect() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath();
                if ("POST".equals(request.getMethod()) && "/session".equals(path)) {
                    return new MockResponse()
                        .setResponseCode(302)
                        .addHeader("Set-Cookie", "sid=xyz; Path=/")
                        .addHeader("Location", "/dashboard");
                }
                if ("/dashboard".equals(path)) {
                    return new MockResponse().setBody("<html><body>Welcome back</body></html>");
                }
                return new MockResponse().setResponseCode(404);
            }
        });
        server.start();
        String loginUrl = server.url("/account").toString();
        AuthConfig.Form form = new AuthConfig.Form("alice", "s3cret", null, null, null, null, null);
        BrowsingContext context = adapter.prepare(form, loginUrl);
        Document page = Jsoup.parse(LOGIN_PAGE, loginUrl);
        LoginDetection detection = new HtmlLoginDetector().detect(page, loginUrl);

        HttpFetchResult result = adapter.performFormLogin(context, page, form, detection, Duration.ofSeconds(5));

        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.finalUrlOrRequested()).endsWith("/dashboard");
        assertThat(context.formLoginPerformed()).isTrue();
        assertThat(context.cookieHeader(URI.create(server.url("/docs").toString()))).isEqualTo("sid=xyz");

        RecordedRequest submit = server.takeRequest();
        assertThat(submit.getMethod()).isEqualTo("POST");
        assertThat(submit.getBody().readUtf8()).isEqualTo("csrf=token-1&username=alice&password=s3cret");
        RecordedRequest followUp = server.takeRequest();
        assertThat(followUp.getPath()).isEqualTo("/dashboard");
        assertThat(followUp.getHeader("Cookie")).isEqualTo("sid=xyz");
    }

    @Test
    void formLoginThatLandsBackOnLoginPageFails() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if ("POST".equals(request.getMethod())) {
                    return new MockResponse().setResponseCode(302).addHeader("Location", "/login?error=1");
                }
                return new MockResponse().setBody(LOGIN_PAGE);
            }
        });
        server.start();
        String loginUrl = server.url("/login").toString();
        AuthConfig.Form form = new AuthConfig.Form("alice", "wrong", null, null, null, null, null);
        BrowsingContext context = adapter.prepare(form, loginUrl);
        Document page = Jsoup.parse(LOGIN_PAGE, loginUrl);
        LoginDetection detection = new HtmlLoginDetector().detect(page, loginUrl);

        assertThatThrownBy(() -> adapter.performFormLogin(context, page, form, detection, Duration.ofSeconds(5)))
            .isInstanceOf(AuthenticationException.class)
            .hasMessage("Authentication failed - still on login page. Please check credentials.");
        assertThat(context.formLoginPerformed()).isFalse();
    }

    @Test
    void missingConfiguredFormSelectorFails() {
        AuthConfig.Form form = new AuthConfig.Form("alice", "pw", "#does-not-exist", null, null, null, null);
        BrowsingContext context = adapter.prepare(form, "https://example.com/login");
        Document page = Jsoup.parse(LOGIN_PAGE, "https://example.com/login");

        assertThatThrownBy(() -> adapter.performFormLogin(context, page, form, null, Duration.ofSeconds(5)))
            .isInstanceOf(AuthenticationException.class)
            .hasMessageContaining("login form not found: #does-not-exist");
    }
}
