package com.delta.pagetracker.crawl.auth;

import java.net.HttpCookie;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

public class BrowsingContext {
    private final AuthKind authKind;
    private final String defaultHost;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private final List<StoredCookie> cookies = Collections.synchronizedList(new ArrayList<>());
    private final AuthConfig.Form formLogin;
    private final String unsupportedReason;
    private volatile boolean formLoginPerformed;

    BrowsingContext(AuthKind authKind, String defaultHost, AuthConfig.Form formLogin, String unsupportedReason) {
        this.authKind = authKind;
        this.defaultHost = defaultHost == null ? null : defaultHost.toLowerCase(Locale.ROOT);
        this.formLogin = formLogin;
        this.unsupportedReason = unsupportedReason;
    }

    public static BrowsingContext anonymous() {
        return new BrowsingContext(null, null, null, null);
    }

    public AuthKind authKind() {
        return authKind;
    }

    public boolean hasCredential() {
        return authKind != null;
    }

    public AuthConfig.Form formLogin() {
        return formLogin;
    }

    public String unsupportedReason() {
        return unsupportedReason;
    }

    public boolean isUnsupported() {
        return unsupportedReason != null;
    }

    public boolean formLoginPerformed() {
        return formLoginPerformed;
    }

    void markFormLoginPerformed() {
        this.formLoginPerformed = true;
    }

    public String authMethod() {
        if (authKind == null) {
            return "none";
        }
        return authKind == AuthKind.SSO ? "sso" : "credentials";
    }

    void putHeader(String name, String value) {
        if (name == null || name.isBlank() || value == null) {
            return;
        }
        headers.put(name.trim(), value);
    }

    public Map<String, String> headers() {
        return Collections.unmodifiableMap(headers);
    }

    public void addCookie(String name, String value, String domain, String path) {
        if (name == null || name.isBlank()) {
            return;
        }
        String cookieDomain = domain == null || domain.isBlank() ? defaultHost : stripLeadingDot(domain);
        String cookiePath = path == null || path.isBlank() ? "/" : path.trim();
        synchronized (cookies) {
            cookies.removeIf(c -> c.name().equals(name) && sameDomain(c.domain(), cookieDomain) && c.path().equals(cookiePath));
            cookies.add(new StoredCookie(name, value == null ? "" : value, cookieDomain, cookiePath));
        }
    }

    public void captureSetCookies(URI responseUri, List<String> setCookieHeaders) {
        if (setCookieHeaders == null || setCookieHeaders.isEmpty()) {
            return;
        }
        String host = responseUri == null || responseUri.getHost() == null
            ? defaultHost
            : responseUri.getHost().toLowerCase(Locale.ROOT);
        for (String header : setCookieHeaders) {
            List<HttpCookie> parsed;
            try {
                parsed = HttpCookie.parse(header);
            } catch (IllegalArgumentException e) {
                continue;
            }
            for (HttpCookie cookie : parsed) {
                String domain = cookie.getDomain() == null ? host : stripLeadingDot(cookie.getDomain());
                String path = cookie.getPath() == null ? "/" : cookie.getPath();
                if (cookie.getMaxAge() == 0) {
                    synchronized (cookies) {
                        cookies.removeIf(c -> c.name().equals(cookie.getName()) && sameDomain(c.domain(), domain));
                    }
                    continue;
                }
                addCookie(cookie.getName(), cookie.getValue(), domain, path);
            }
        }
    }

    public String cookieHeader(URI uri) {
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        StringJoiner joiner = new StringJoiner("; ");
        synchronized (cookies) {
            for (StoredCookie cookie : cookies) {
                if (domainMatches(host, cookie.domain()) && path.startsWith(cookie.path())) {
                    joiner.add(cookie.name() + "=" + cookie.value());
                }
            }
        }
        return joiner.length() == 0 ? null : joiner.toString();
    }

    public Map<String, String> requestHeaders(URI uri) {
        Map<String, String> out = new LinkedHashMap<>(headers);
        String cookieHeader = cookieHeader(uri);
        if (cookieHeader != null) {
            out.put("Cookie", cookieHeader);
        }
        return out;
    }

    public int cookieCount() {
        return cookies.size();
    }

    private static boolean domainMatches(String host, String cookieDomain) {
        if (cookieDomain == null) {
            return true;
        }
        return host.equals(cookieDomain) || host.endsWith("." + cookieDomain);
    }

    private static boolean sameDomain(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    private static String stripLeadingDot(String domain) {
        String d = domain.trim().toLowerCase(Locale.ROOT);
        return d.startsWith(".") ? d.substring(1) : d;
    }

    @Override
    public String toString() {
        return "BrowsingContext[authKind=" + authKind + ", headers=" + headers.keySet()
            + ", cookies=" + cookies.size() + ", unsupported=" + (unsupportedReason != null) + "]";
    }

    private record StoredCookie(String name, String value, String domain, String path) {
    }
}
