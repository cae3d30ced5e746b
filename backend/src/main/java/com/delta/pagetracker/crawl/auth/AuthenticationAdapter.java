package com.delta.pagetracker.crawl.auth;

import com.delta.pagetracker.crawl.http.PoliteHttpClient;
import com.delta.pagetracker.crawl.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Component
public class AuthenticationAdapter {
    private static final Logger log = LoggerFactory.getLogger(AuthenticationAdapter.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    static final String SSO_UNSUPPORTED =
        "SSO cannot be performed server-side without a real session token; needs manual credential (cookie or header)";

    private final PoliteHttpClient httpClient;

    public AuthenticationAdapter(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public BrowsingContext prepare(AuthConfig config, String baseUrl) {
        String host = DomainRules.hostOf(baseUrl);
        if (config == null) {
            return new BrowsingContext(null, host, null, null);
        }
        if (config instanceof AuthConfig.Basic basic) {
            BrowsingContext context = new BrowsingContext(AuthKind.BASIC, host, null, null);
            String token = Base64.getEncoder().encodeToString(
                (nullToEmpty(basic.username()) + ":" + nullToEmpty(basic.password())).getBytes(StandardCharsets.UTF_8)
            );
            context.putHeader("Authorization", "Basic " + token);
            return context;
        }
        if (config instanceof AuthConfig.Header header) {
            BrowsingContext context = new BrowsingContext(AuthKind.HEADER, host, null, null);
            header.headers().forEach(context::putHeader);
            return context;
        }
        if (config instanceof AuthConfig.Cookie cookie) {
            BrowsingContext context = new BrowsingContext(AuthKind.COOKIE, host, null, null);
            for (AuthConfig.CookieEntry entry : cookie.cookies()) {
                context.addCookie(entry.name(), entry.value(), entry.domain(), entry.path());
            }
            return context;
        }
        if (config instanceof AuthConfig.Form form) {
            return new BrowsingContext(AuthKind.FORM, host, form, null);
        }
        log.warn("SSO credential for host={} ignored: {}", host, SSO_UNSUPPORTED);
        return new BrowsingContext(AuthKind.SSO, host, null, SSO_UNSUPPORTED);
    }

    public HttpFetchResult performFormLogin(
        BrowsingContext context,
        Document page,
        AuthConfig.Form form,
        LoginDetection detection,
        Duration timeout
    ) {
        if (form == null) {
            throw new AuthenticationException("No form credential configured", LoginMethod.FORM.value());
        }
        LoginDetection.SuggestedFields suggested = detection == null
            ? LoginDetection.SuggestedFields.none()
            : detection.suggestedFields();
        Document loginPage = resolveLoginPage(context, page, form, timeout);

        Element formElement = locateForm(loginPage, firstNonBlank(form.formSelector(), suggested.formSelector()));
        Element usernameInput = locateInput(loginPage, firstNonBlank(form.usernameField(), suggested.usernameSelector()), "username");
        Element passwordInput = locateInput(loginPage, firstNonBlank(form.passwordField(), suggested.passwordSelector()), "password");

        Map<String, String> fields = collectFormFields(formElement);
        fields.put(usernameInput.attr("name"), nullToEmpty(form.username()));
        fields.put(passwordInput.attr("name"), nullToEmpty(form.password()));
        if (form.submitButton() != null && !form.submitButton().isBlank()) {
            Element button = loginPage.selectFirst(form.submitButton());
            if (button == null) {
                throw new AuthenticationException(
                    "Form authentication failed: submit button not found: " + form.submitButton(),
                    LoginMethod.FORM.value()
                );
            }
            if (!button.attr("name").isBlank()) {
                fields.put(button.attr("name"), button.val());
            }
        }

        String action = formElement.attr("action").isBlank() ? loginPage.location() : formElement.absUrl("action");
        if (action == null || action.isBlank()) {
            action = loginPage.location();
        }
        String method = formElement.attr("method").toUpperCase(Locale.ROOT);
        HttpFetchResult result;
        if ("GET".equals(method)) {
            String separator = action.contains("?") ? "&" : "?";
            result = httpClient.get(action + separator + PoliteHttpClient.encodeForm(fields), HTML_ACCEPT, context, timeout);
        } else {
            result = httpClient.postForm(action, fields, HTML_ACCEPT, context, timeout);
        }

        if (!result.isSuccessful()) {
            String detail = result.errorCode() != null
                ? result.errorCode()
                : "HTTP " + result.statusCode();
            throw new AuthenticationException("Form authentication failed: " + detail, LoginMethod.FORM.value());
        }
        if (isLoginUrl(result.finalUrlOrRequested())) {
            log.warn("Still on login page after form submission url={}", result.finalUrlOrRequested());
            throw new AuthenticationException(
                "Authentication failed - still on login page. Please check credentials.",
                LoginMethod.FORM.value()
            );
        }
        context.markFormLoginPerformed();
        log.info("Form authentication completed url={} cookies={}", result.finalUrlOrRequested(), context.cookieCount());
        return result;
    }

    public AuthErrorAssessment classifyError(String url, String message) {
        return AuthErrorClassifier.classify(url, message);
    }

    public static String determineContentType(String url, String authMethod) {
        if ("sso".equals(authMethod)) {
            return "internal";
        }
        if ("credentials".equals(authMethod)) {
            return "credential-based";
        }
        return DomainRules.isInternalDomain(url) ? "internal" : "public";
    }

    public static boolean isLoginUrl(String url) {
        if (url == null) {
            return false;
        }
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            path = url;
        }
        String lower = path == null ? "" : path.toLowerCase(Locale.ROOT);
        return lower.contains("/login") || lower.contains("/signin");
    }

    private Document resolveLoginPage(BrowsingContext context, Document page, AuthConfig.Form form, Duration timeout) {
        String loginUrl = form.loginUrl();
        if (loginUrl == null || loginUrl.isBlank() || (page != null && loginUrl.equals(page.location()))) {
            if (page == null) {
                throw new AuthenticationException("Form authentication failed: no login page available", LoginMethod.FORM.value());
            }
            return page;
        }
        HttpFetchResult loginResponse = httpClient.get(loginUrl, HTML_ACCEPT, context, timeout);
        if (!loginResponse.isSuccessful() || loginResponse.body() == null) {
            String detail = loginResponse.errorCode() != null
                ? loginResponse.errorCode()
                : "HTTP " + loginResponse.statusCode();
            throw new AuthenticationException("Form authentication failed: login page " + loginUrl + " returned " + detail,
                LoginMethod.FORM.value());
        }
        return Jsoup.parse(loginResponse.body(), loginResponse.finalUrlOrRequested());
    }

    private Element locateForm(Document page, String selector) {
        if (selector != null) {
            Element match = page.selectFirst(selector);
            if (match == null) {
                throw new AuthenticationException(
                    "Form authentication failed: login form not found: " + selector,
                    LoginMethod.FORM.value()
                );
            }
            if ("form".equals(match.normalName())) {
                return match;
            }
            Element enclosing = match.closest("form");
            if (enclosing != null) {
                return enclosing;
            }
            Element nested = match.selectFirst("form");
            return nested != null ? nested : match;
        }
        Element password = page.selectFirst("input[type=password]");
        Element enclosing = password == null ? null : password.closest("form");
        if (enclosing == null) {
            throw new AuthenticationException("Form authentication failed: no login form on page", LoginMethod.FORM.value());
        }
        return enclosing;
    }

    private Element locateInput(Document page, String selector, String label) {
        Element input = null;
        if (selector != null) {
            input = page.selectFirst(selector);
        } else if ("password".equals(label)) {
            input = page.selectFirst("input[type=password]");
        }
        if (input == null || input.attr("name").isBlank()) {
            throw new AuthenticationException(
                "Form authentication failed: " + label + " field not found" + (selector == null ? "" : ": " + selector),
                LoginMethod.FORM.value()
            );
        }
        return input;
    }

    private Map<String, String> collectFormFields(Element form) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (Element input : form.select("input[name], select[name], textarea[name]")) {
            if (input.hasAttr("disabled")) {
                continue;
            }
            String type = input.attr("type").toLowerCase(Locale.ROOT);
            if (type.equals("submit") || type.equals("button") || type.equals("image") || type.equals("reset")) {
                continue;
            }
            if ((type.equals("checkbox") || type.equals("radio")) && !input.hasAttr("checked")) {
                continue;
            }
            if ("select".equals(input.normalName())) {
                Element selected = input.selectFirst("option[selected]");
                if (selected == null) {
                    selected = input.selectFirst("option");
                }
                fields.put(input.attr("name"), selected == null ? "" : selected.val());
                continue;
            }
            fields.put(input.attr("name"), input.val());
        }
        return fields;
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second == null || second.isBlank() ? null : second;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
