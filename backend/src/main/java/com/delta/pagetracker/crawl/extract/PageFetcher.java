package com.delta.pagetracker.crawl.extract;

import com.delta.pagetracker.crawl.auth.AuthErrorClassifier;
import com.delta.pagetracker.crawl.auth.AuthenticationAdapter;
import com.delta.pagetracker.crawl.auth.AuthenticationException;
import com.delta.pagetracker.crawl.auth.BrowsingContext;
import com.delta.pagetracker.crawl.auth.DomainRules;
import com.delta.pagetracker.crawl.auth.LoginDetection;
import com.delta.pagetracker.crawl.auth.LoginDetector;
import com.delta.pagetracker.crawl.auth.LoginMethod;
import com.delta.pagetracker.crawl.http.PoliteHttpClient;
import com.delta.pagetracker.crawl.model.HttpFetchResult;
import com.delta.pagetracker.crawl.model.ScrapedPage;
import com.delta.pagetracker.crawl.template.WebsiteTemplate;
import com.delta.pagetracker.crawl.traversal.CrawlOptions;
import com.delta.pagetracker.crawl.util.ReasonCodeClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

@Component
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final PoliteHttpClient httpClient;
    private final AuthenticationAdapter authenticationAdapter;
    private final LoginDetector loginDetector;
    private final PageExtractor extractor;

    public PageFetcher(
        PoliteHttpClient httpClient,
        AuthenticationAdapter authenticationAdapter,
        LoginDetector loginDetector,
        PageExtractor extractor
    ) {
        this.httpClient = httpClient;
        this.authenticationAdapter = authenticationAdapter;
        this.loginDetector = loginDetector;
        this.extractor = extractor;
    }

    public ScrapedPage fetchAndExtract(
        String url,
        int depth,
        String parentUrl,
        WebsiteTemplate template,
        BrowsingContext context,
        CrawlOptions options
    ) {
        Duration timeout = Duration.ofMillis(options.timeoutMs());
        HttpFetchResult result = fetch(url, context, timeout);
        Document document = parse(result);

        if (options.enableCredentialPrompting() && document != null) {
            LoginDetection detection = loginDetector.detect(document, result.finalUrlOrRequested());
            if (detection.loginPage()) {
                result = handleLoginWall(url, document, detection, context, timeout);
                document = parse(result);
            }
        }

        if (!result.isSuccessful()) {
            throw httpFailure(url, result.statusCode(), context);
        }

        String html = result.isHtml() && result.body() != null ? result.body() : "";
        ScrapedPage page = extractor.extract(html, result.finalUrlOrRequested(), depth, parentUrl, template, result.fetchedAt());
        String authMethod = context.authMethod();
        String contentType = AuthenticationAdapter.determineContentType(url, authMethod);
        log.debug("Extracted url={} chars={} links={}", url, page.content().length(), page.metadata().links().size());
        return new ScrapedPage(
            url,
            page.title(),
            page.content(),
            page.contentHash(),
            page.metadata().withAccess(authMethod, contentType),
            page.fetchedAt() == null ? Instant.now() : page.fetchedAt()
        );
    }

    private HttpFetchResult handleLoginWall(
        String url,
        Document loginPage,
        LoginDetection detection,
        BrowsingContext context,
        Duration timeout
    ) {
        String host = DomainRules.hostOf(url);
        LoginMethod method = detection.loginMethod() == null ? LoginMethod.UNKNOWN : detection.loginMethod();
        if (context.isUnsupported()) {
            throw new AuthenticationException(
                "Login page detected. " + context.unsupportedReason() + ". "
                    + AuthErrorClassifier.credentialPrompt(host, method.value()),
                method.value()
            );
        }
        if (method != LoginMethod.FORM || context.formLogin() == null) {
            throw new AuthenticationException(
                "Login page detected but no matching authentication configured. "
                    + AuthErrorClassifier.credentialPrompt(host, method.value()),
                method.value()
            );
        }
        log.info("Login page detected url={} method={}; submitting configured form credential", url, method.value());
        try {
            authenticationAdapter.performFormLogin(context, loginPage, context.formLogin(), detection, timeout);
        } catch (AuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuthenticationException("Form authentication failed: " + e.getMessage(), method.value(), e);
        }

        HttpFetchResult refetched = fetch(url, context, timeout);
        Document document = parse(refetched);
        if (document != null
            && (AuthenticationAdapter.isLoginUrl(refetched.finalUrlOrRequested())
                || loginDetector.detect(document, refetched.finalUrlOrRequested()).loginPage())) {
            throw new AuthenticationException(
                "Authentication failed - still on login page. Please check credentials.",
                method.value()
            );
        }
        return refetched;
    }

    private HttpFetchResult fetch(String url, BrowsingContext context, Duration timeout) {
        HttpFetchResult result = httpClient.get(url, HTML_ACCEPT, context, timeout);
        if (result.errorCode() != null) {
            String reason = ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage());
            String message = "timeout".equals(result.errorCode())
                ? "Timed out after " + timeout.toMillis() + "ms"
                : "Request failed (" + result.errorCode() + "): " + result.errorMessage();
            throw new PageFetchException(url, null, reason, message);
        }
        return result;
    }

    private PageFetchException httpFailure(String url, int status, BrowsingContext context) {
        String message = "HTTP " + status;
        if ((status == 401 || status == 403) && context.isUnsupported()) {
            message = message + " - " + context.unsupportedReason();
        }
        return new PageFetchException(url, status, ReasonCodeClassifier.fromHttpStatus(status), message);
    }

    private static Document parse(HttpFetchResult result) {
        if (result.body() == null || !result.isHtml()) {
            return null;
        }
        return Jsoup.parse(result.body(), result.finalUrlOrRequested());
    }
}
