package com.delta.pagetracker.crawl.auth;

import java.util.List;
import java.util.regex.Pattern;

public final class AuthErrorClassifier {
    private static final List<Pattern> AUTH_ERROR_PATTERNS = List.of(
        Pattern.compile("login", Pattern.CASE_INSENSITIVE),
        Pattern.compile("signin", Pattern.CASE_INSENSITIVE),
        Pattern.compile("authenticat", Pattern.CASE_INSENSITIVE),
        Pattern.compile("unauthorized", Pattern.CASE_INSENSITIVE),
        Pattern.compile("access.*denied", Pattern.CASE_INSENSITIVE),
        Pattern.compile("permission.*denied", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b40[13]\\b")
    );

    private AuthErrorClassifier() {
    }

    public static AuthErrorAssessment classify(String url, String message) {
        if (message == null || message.isBlank() || !isAuthError(message)) {
            return AuthErrorAssessment.notAuthError();
        }
        String host = DomainRules.hostOf(url);
        String domain = host == null ? "this site" : host;
        if (DomainRules.isInternalDomain(url)) {
            String suggestion = "This appears to be an internal website (" + domain + ") that requires authentication. "
                + "Server-side SSO is not supported; configure a cookie or header credential manually. "
                + DomainRules.internalPlatformHint(host) + ".";
            return new AuthErrorAssessment(true, true, "cookie", suggestion);
        }
        if (DomainRules.isExternalCredentialSite(url)) {
            String suggestion = "This external website (" + domain + ") requires authentication. "
                + "Please provide credentials in the Credentials Manager for automatic login.";
            return new AuthErrorAssessment(true, true, LoginMethod.FORM.value(), suggestion);
        }
        String suggestion = "This website requires authentication. If this is an internal company website, "
            + "configure cookie or header credentials in the Credentials Manager.";
        return new AuthErrorAssessment(true, true, null, suggestion);
    }

    public static boolean isAuthError(String message) {
        if (message == null) {
            return false;
        }
        for (Pattern pattern : AUTH_ERROR_PATTERNS) {
            if (pattern.matcher(message).find()) {
                return true;
            }
        }
        return false;
    }

    public static String credentialPrompt(String domain, String loginMethod) {
        String base = "Authentication required for " + domain + ".";
        if (loginMethod == null) {
            return base + " Please configure appropriate credentials in the Credentials Manager.";
        }
        return switch (loginMethod) {
            case "saml" -> base + " This site uses SAML/SSO authentication, which cannot be performed server-side. "
                + "Please configure a cookie or header credential in the Credentials Manager.";
            case "oauth" -> base + " This site uses OAuth authentication. "
                + "Please configure a cookie or header credential in the Credentials Manager.";
            case "form" -> base + " Please provide username and password credentials in the Credentials Manager.";
            default -> base + " Please configure appropriate credentials in the Credentials Manager.";
        };
    }
}
