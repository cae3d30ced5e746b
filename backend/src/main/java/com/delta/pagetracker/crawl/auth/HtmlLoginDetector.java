package com.delta.pagetracker.crawl.auth;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

@Component
public class HtmlLoginDetector implements LoginDetector {
    private static final Logger log = LoggerFactory.getLogger(HtmlLoginDetector.class);

    private static final List<Pattern> LOGIN_VOCABULARY = List.of(
        Pattern.compile("sign\\s*in", Pattern.CASE_INSENSITIVE),
        Pattern.compile("log\\s*in", Pattern.CASE_INSENSITIVE),
        Pattern.compile("login", Pattern.CASE_INSENSITIVE),
        Pattern.compile("authentication", Pattern.CASE_INSENSITIVE),
        Pattern.compile("credentials", Pattern.CASE_INSENSITIVE),
        Pattern.compile("username", Pattern.CASE_INSENSITIVE),
        Pattern.compile("password", Pattern.CASE_INSENSITIVE),
        Pattern.compile("email.*password", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern LOGIN_PATH = Pattern.compile("/(login|signin|auth|authentication|sso)\\b", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> SAML_MARKERS = List.of(
        Pattern.compile("saml", Pattern.CASE_INSENSITIVE),
        Pattern.compile("single.*sign.*on", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\bsso\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("identity.*provider", Pattern.CASE_INSENSITIVE),
        Pattern.compile("federation", Pattern.CASE_INSENSITIVE)
    );
    private static final List<Pattern> OAUTH_MARKERS = List.of(
        Pattern.compile("oauth", Pattern.CASE_INSENSITIVE),
        Pattern.compile("google.*sign.*in", Pattern.CASE_INSENSITIVE),
        Pattern.compile("microsoft.*sign.*in", Pattern.CASE_INSENSITIVE),
        Pattern.compile("github.*sign.*in", Pattern.CASE_INSENSITIVE)
    );

    private static final Map<String, SiteSelectors> SITE_SELECTORS = new LinkedHashMap<>();

    static {
        SITE_SELECTORS.put("launchpad.support.sap.com", new SiteSelectors(
            List.of("#j_username", "[name=j_username]", "[name=username]"),
            List.of("#j_password", "[name=j_password]", "[name=password]"),
            List.of("#logOnFormSubmit", "[type=submit]"),
            "#logonForm"
        ));
        SITE_SELECTORS.put("support.sap.com", new SiteSelectors(
            List.of("#j_username", "[name=j_username]", "[name=username]", "#username"),
            List.of("#j_password", "[name=j_password]", "[name=password]", "#password"),
            List.of("#logOnFormSubmit", "[type=submit]", "button[type=submit]"),
            "#logonForm"
        ));
        SITE_SELECTORS.put("me.sap.com", new SiteSelectors(
            List.of("#j_username", "[name=username]", "#username"),
            List.of("#j_password", "[name=password]", "#password"),
            List.of("[type=submit]", "button[type=submit]"),
            null
        ));
        SITE_SELECTORS.put("salesforce.com", new SiteSelectors(
            List.of("#username", "[name=username]"),
            List.of("#password", "[name=password]"),
            List.of("#Login", "[name=Login]", "[type=submit]"),
            null
        ));
        SITE_SELECTORS.put("servicenow.com", new SiteSelectors(
            List.of("#user_name", "[name=user_name]", "[name=username]"),
            List.of("#user_password", "[name=user_password]", "[name=password]"),
            List.of("#sysverb_login", "[type=submit]"),
            null
        ));
    }

    private static final SiteSelectors GENERIC = new SiteSelectors(
        List.of(
            "[name=username]",
            "[name=email]",
            "[name=user]",
            "[name=login]",
            "[type=email]",
            "#username",
            "#email",
            "#user",
            "#login",
            ".username",
            ".email",
            "[placeholder*=username]",
            "[placeholder*=email]",
            "[aria-label*=username]",
            "[aria-label*=email]"
        ),
        List.of(
            "[name=password]",
            "[name=passwd]",
            "[name=pass]",
            "[type=password]",
            "#password",
            "#passwd",
            "#pass",
            ".password",
            "[placeholder*=password]",
            "[aria-label*=password]"
        ),
        List.of(
            "button[type=submit]",
            "input[type=submit]",
            "[type=submit]",
            "button:contains(Sign In)",
            "button:contains(Log In)",
            "button:contains(Login)",
            "button:contains(Submit)",
            ".login-button",
            ".signin-button",
            ".submit-button"
        ),
        null
    );

    @Override
    public LoginDetection detect(Document document, String url) {
        if (document == null) {
            return LoginDetection.notLoginPage();
        }
        String title = document.title();
        String bodyText = document.body() == null ? "" : document.body().text();
        String location = url == null ? "" : url;
        boolean hasPasswordField = document.selectFirst("input[type=password]") != null;
        boolean loginPath = LOGIN_PATH.matcher(location).find();
        if (!hasPasswordField && !loginPath) {
            return LoginDetection.notLoginPage();
        }
        if (!matchesAny(LOGIN_VOCABULARY, title) && !matchesAny(LOGIN_VOCABULARY, bodyText) && !loginPath) {
            return LoginDetection.notLoginPage();
        }

        LoginMethod method = determineLoginMethod(document, bodyText);
        log.debug("Login page detected url={} method={}", url, method.value());
        if (method != LoginMethod.FORM) {
            return new LoginDetection(
                true,
                method,
                LoginDetection.SuggestedFields.none(),
                "Login method \"" + method.value() + "\" is not supported for automated authentication."
            );
        }
        LoginDetection.SuggestedFields fields = findFormFields(document, DomainRules.hostOf(url));
        if (fields.usernameSelector() == null || fields.passwordSelector() == null) {
            return new LoginDetection(
                true,
                method,
                fields,
                "Could not locate username or password fields on the login form."
            );
        }
        return new LoginDetection(true, method, fields, null);
    }

    private LoginMethod determineLoginMethod(Document document, String bodyText) {
        for (Element form : document.select("form")) {
            boolean password = form.selectFirst("[type=password]") != null;
            boolean username = form.selectFirst("[type=email], [name*=username], [name*=email], [name*=user]") != null;
            if (password && username) {
                return LoginMethod.FORM;
            }
        }
        if (matchesAny(SAML_MARKERS, bodyText)) {
            return LoginMethod.SAML;
        }
        if (matchesAny(OAUTH_MARKERS, bodyText)) {
            return LoginMethod.OAUTH;
        }
        for (Element link : document.select("a[href]")) {
            if (matchesAny(OAUTH_MARKERS, link.attr("href"))) {
                return LoginMethod.OAUTH;
            }
        }
        return LoginMethod.UNKNOWN;
    }

    private LoginDetection.SuggestedFields findFormFields(Document document, String host) {
        SiteSelectors site = siteSelectorsFor(host);
        String username = null;
        String password = null;
        String submit = null;
        String form = null;
        if (site != null) {
            username = firstPresent(document, site.username());
            password = firstPresent(document, site.password());
            submit = firstPresent(document, site.submit());
            if (site.form() != null && document.selectFirst(site.form()) != null) {
                form = site.form();
            }
        }
        if (username == null) {
            username = firstPresent(document, GENERIC.username());
        }
        if (password == null) {
            password = firstPresent(document, GENERIC.password());
        }
        if (submit == null) {
            submit = firstPresent(document, GENERIC.submit());
        }
        if (form == null && username != null) {
            form = enclosingFormSelector(document.selectFirst(username));
        }
        return new LoginDetection.SuggestedFields(username, password, submit, form);
    }

    private SiteSelectors siteSelectorsFor(String host) {
        if (host == null) {
            return null;
        }
        String h = host.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, SiteSelectors> entry : SITE_SELECTORS.entrySet()) {
            if (h.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private String firstPresent(Document document, List<String> selectors) {
        for (String selector : selectors) {
            try {
                if (document.selectFirst(selector) != null) {
                    return selector;
                }
            } catch (Selector.SelectorParseException e) {
                log.debug("Skipping unparseable selector {}", selector);
            }
        }
        return null;
    }

    private String enclosingFormSelector(Element field) {
        if (field == null) {
            return null;
        }
        Element form = field.closest("form");
        if (form == null) {
            return null;
        }
        if (!form.id().isBlank()) {
            return "#" + form.id();
        }
        if (!form.className().isBlank()) {
            return "form." + form.className().trim().split("\\s+")[0];
        }
        return "form";
    }

    private static boolean matchesAny(List<Pattern> patterns, String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(value).find()) {
                return true;
            }
        }
        return false;
    }

    private record SiteSelectors(List<String> username, List<String> password, List<String> submit, String form) {
    }
}
