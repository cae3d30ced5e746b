package com.delta.pagetracker.crawl.auth;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class DomainRules {
    private static final List<Pattern> INTERNAL_HOST_PATTERNS = List.of(
        Pattern.compile(".*\\.company\\.com$"),
        Pattern.compile(".*\\.sharepoint\\.com$"),
        Pattern.compile(".*\\.onmicrosoft\\.com$"),
        Pattern.compile(".*\\.teams\\.microsoft\\.com$"),
        Pattern.compile(".*\\.office\\.com$"),
        Pattern.compile(".*\\.outlook\\.com$"),
        Pattern.compile(".*\\.atlassian\\.net$"),
        Pattern.compile(".*\\.atlassian\\.com$"),
        Pattern.compile(".*\\.google\\.com$"),
        Pattern.compile(".*\\.gsuite\\.com$"),
        Pattern.compile(".*\\.corp\\..*"),
        Pattern.compile(".*\\.internal$"),
        Pattern.compile(".*\\.intranet$"),
        Pattern.compile(".*\\.local$")
    );

    private static final List<String> SSO_FRONTED_DOMAINS = List.of(
        "company.com",
        "sharepoint.com",
        "onmicrosoft.com",
        "atlassian.net",
        "atlassian.com",
        "google.com"
    );

    private static final List<Pattern> EXTERNAL_CREDENTIAL_PATTERNS = List.of(
        Pattern.compile(".*launchpad\\.support\\.sap\\.com$"),
        Pattern.compile(".*\\.support\\.sap\\.com$"),
        Pattern.compile(".*me\\.sap\\.com$"),
        Pattern.compile(".*\\.salesforce\\.com$"),
        Pattern.compile(".*\\.oracle\\.com$"),
        Pattern.compile(".*\\.aws\\.amazon\\.com$"),
        Pattern.compile(".*\\.azure\\.microsoft\\.com$"),
        Pattern.compile(".*\\.servicenow\\.com$"),
        Pattern.compile(".*\\.zendesk\\.com$"),
        Pattern.compile(".*\\.freshdesk\\.com$")
    );

    private DomainRules() {
    }

    public static boolean isInternalDomain(String url) {
        String host = hostOf(url);
        if (host == null) {
            return false;
        }
        for (Pattern pattern : INTERNAL_HOST_PATTERNS) {
            if (pattern.matcher(host).matches()) {
                return true;
            }
        }
        for (String domain : SSO_FRONTED_DOMAINS) {
            if (host.contains(domain)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isExternalCredentialSite(String url) {
        String host = hostOf(url);
        if (host == null) {
            return false;
        }
        for (Pattern pattern : EXTERNAL_CREDENTIAL_PATTERNS) {
            if (pattern.matcher(host).matches()) {
                return true;
            }
        }
        return false;
    }

    public static String internalPlatformHint(String host) {
        String h = host == null ? "" : host.toLowerCase(Locale.ROOT);
        if (h.contains("atlassian")) {
            return "For Atlassian sites: use Cookie authentication with session cookies from your browser (F12 -> Application -> Cookies)";
        }
        if (h.contains("sharepoint") || h.contains("office") || h.contains("microsoft")) {
            return "For SharePoint/Office 365: use Cookie authentication with FedAuth cookies from your browser";
        }
        if (h.contains("google")) {
            return "For Google sites: use Cookie authentication with SAPISID/APISID cookies from your browser";
        }
        return "For internal sites: use Cookie authentication with session cookies from your browser (F12 -> Developer Tools)";
    }

    public static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String host = new URI(url.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
