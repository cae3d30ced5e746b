package com.delta.pagetracker.crawl.traversal;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public final class UrlNormalizer {
    private static final Set<String> TRACKING_PARAMS = Set.of(
        "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content", "gclid", "fbclid"
    );

    private UrlNormalizer() {
    }

    /** Canonical absolute http(s) URL with the path kept as is, or null. */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return null;
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        String query = filterQueryParams(uri.getRawQuery());

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (query != null) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    /**
     * Key for the visited and failed sets; {@code /docs} and {@code /docs/} share one key.
     */
    public static String dedupKey(String url) {
        String normalized = normalize(url);
        if (normalized == null) {
            return null;
        }
        int queryStart = normalized.indexOf('?');
        String base = queryStart < 0 ? normalized : normalized.substring(0, queryStart);
        String query = queryStart < 0 ? "" : normalized.substring(queryStart);
        int pathStart = base.indexOf('/', base.indexOf("://") + 3);
        if (base.endsWith("/") && base.length() - pathStart > 1) {
            base = base.substring(0, base.length() - 1);
        }
        return base + query;
    }

    public static String origin(String url) {
        String normalized = normalize(url);
        if (normalized == null) {
            return null;
        }
        URI uri = URI.create(normalized);
        int port = uri.getPort();
        return uri.getScheme() + "://" + uri.getHost() + (port == -1 ? "" : ":" + port);
    }

    public static boolean isSameSite(String rootUrl, String candidateUrl) {
        String rootOrigin = origin(rootUrl);
        return rootOrigin != null && rootOrigin.equals(origin(candidateUrl));
    }

    private static String filterQueryParams(String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        String filtered = Arrays.stream(query.split("&"))
            .filter(param -> !param.isEmpty())
            .filter(param -> {
                String key = param.contains("=") ? param.substring(0, param.indexOf('=')) : param;
                return !TRACKING_PARAMS.contains(key.toLowerCase(Locale.ROOT));
            })
            .sorted()
            .collect(Collectors.joining("&"));
        return filtered.isEmpty() ? null : filtered;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }
}
