package com.delta.pagetracker.crawl.http;

import com.delta.pagetracker.config.CrawlerProperties;
import com.delta.pagetracker.crawl.auth.BrowsingContext;
import com.delta.pagetracker.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final Duration BACKOFF_DURATION = Duration.ofSeconds(30);
    private static final int MAX_REDIRECTS = 10;
    private static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final CrawlerProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Semaphore> hostLimiters = new ConcurrentHashMap<>();
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        CrawlerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getGlobalConcurrency());
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, BrowsingContext.anonymous(), defaultTimeout());
    }

    public HttpFetchResult get(String url, String acceptHeader, BrowsingContext context, Duration timeout) {
        return send(url, "GET", acceptHeader, null, null, context, timeout);
    }

    public HttpFetchResult postForm(
        String url,
        Map<String, String> fields,
        String acceptHeader,
        BrowsingContext context,
        Duration timeout
    ) {
        return send(url, "POST", acceptHeader, encodeForm(fields), FORM_CONTENT_TYPE, context, timeout);
    }

    public HttpFetchResult postJson(String url, String jsonBody, String acceptHeader, Duration timeout) {
        return send(
            url,
            "POST",
            acceptHeader,
            jsonBody == null ? "" : jsonBody,
            JSON_CONTENT_TYPE,
            BrowsingContext.anonymous(),
            timeout
        );
    }

    public static String encodeForm(Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : fields.entrySet()) {
            String value = entry.getValue() == null ? "" : entry.getValue();
            joiner.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(value, StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }

    private HttpFetchResult send(
        String url,
        String method,
        String acceptHeader,
        String body,
        String contentType,
        BrowsingContext context,
        Duration timeout
    ) {
        BrowsingContext safeContext = context == null ? BrowsingContext.anonymous() : context;
        Duration safeTimeout = timeout == null || timeout.isZero() || timeout.isNegative() ? defaultTimeout() : timeout;
        int maxAttempts = Math.max(1, 1 + properties.getRequestMaxRetries());
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeWithRedirects(url, method, acceptHeader, body, contentType, safeContext, safeTimeout);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.debug("Retrying {} {} after attempt={} status={} error={}",
                method, url, attempt, lastResult.statusCode(), lastResult.errorCode());
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeWithRedirects(
        String url,
        String method,
        String acceptHeader,
        String body,
        String contentType,
        BrowsingContext context,
        Duration timeout
    ) {
        Instant startedAt = Instant.now();
        URI origin = normalizeUri(url);
        if (origin == null || origin.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        URI current = origin;
        String currentMethod = method;
        String currentBody = body;
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            HopOutcome outcome = executeOnce(url, origin, current, currentMethod, acceptHeader, currentBody, contentType, context, timeout, startedAt);
            if (outcome.result() != null) {
                return outcome.result();
            }
            URI next = outcome.redirectTo();
            int status = outcome.redirectStatus();
            if (status != 307 && status != 308) {
                currentMethod = "GET";
                currentBody = null;
            }
            current = next;
        }
        return errorResult(url, startedAt, "too_many_redirects", "Exceeded " + MAX_REDIRECTS + " redirects");
    }

    private HopOutcome executeOnce(
        String requestedUrl,
        URI origin,
        URI uri,
        String method,
        String acceptHeader,
        String body,
        String contentType,
        BrowsingContext context,
        Duration timeout,
        Instant startedAt
    ) {
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean acquired = false;
        boolean hostAcquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            Semaphore hostLimiter = hostLimiters.computeIfAbsent(
                host,
                ignored -> new Semaphore(properties.getPerHostConcurrency())
            );
            hostLimiter.acquire();
            hostAcquired = true;
            enforcePerHostDelay(host);

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.8");
            boolean sameHostAsOrigin = host.equalsIgnoreCase(origin.getHost());
            for (Map.Entry<String, String> header : context.requestHeaders(uri).entrySet()) {
                if ("Cookie".equals(header.getKey()) || sameHostAsOrigin) {
                    builder.setHeader(header.getKey(), header.getValue());
                }
            }
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", contentType == null || contentType.isBlank() ? JSON_CONTENT_TYPE : contentType)
                    .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            context.captureSetCookies(response.uri(), response.headers().allValues("Set-Cookie"));
            int status = response.statusCode();
            if (status == 429) {
                extendBackoff(host, BACKOFF_DURATION);
            }
            if (isRedirect(status)) {
                URI location = response.headers().firstValue("Location")
                    .map(value -> resolve(uri, value))
                    .orElse(null);
                if (location != null && location.getHost() != null) {
                    return HopOutcome.redirect(location, status);
                }
            }
            return HopOutcome.done(new HttpFetchResult(
                requestedUrl,
                response.uri(),
                status,
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            ));
        } catch (HttpTimeoutException e) {
            return HopOutcome.done(errorResult(requestedUrl, startedAt, "timeout", e.getMessage()));
        } catch (IOException e) {
            return HopOutcome.done(errorResult(requestedUrl, startedAt, "io_error", e.getClass().getSimpleName() + ": " + e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HopOutcome.done(errorResult(requestedUrl, startedAt, "interrupted", e.getMessage()));
        } catch (RuntimeException e) {
            return HopOutcome.done(errorResult(requestedUrl, startedAt, "http_error", e.getMessage()));
        } finally {
            if (hostAcquired) {
                Semaphore hostLimiter = hostLimiters.get(host);
                if (hostLimiter != null) {
                    hostLimiter.release();
                }
            }
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url")
                && !errorCode.equals("interrupted")
                && !errorCode.equals("too_many_redirects");
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(properties.getPerHostDelayMs()));
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
            }
        }
    }

    private Duration defaultTimeout() {
        return Duration.ofSeconds(properties.getRequestTimeoutSeconds());
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static URI resolve(URI base, String location) {
        try {
            return base.resolve(location.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private record HopOutcome(HttpFetchResult result, URI redirectTo, int redirectStatus) {
        static HopOutcome done(HttpFetchResult result) {
            return new HopOutcome(result, null, 0);
        }

        static HopOutcome redirect(URI location, int status) {
            return new HopOutcome(null, location, status);
        }
    }
}
