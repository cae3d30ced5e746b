package com.delta.pagetracker.crawl.auth;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlLoginDetectorTest {
    private final HtmlLoginDetector detector = new HtmlLoginDetector();

    @Test
    void detectsGenericFormLoginAndSuggestsFields() {
        Document document = Jsoup.parse("""
            <html><head><title>Sign in</title></head><body>
              <form id="login-form" action="/session" method="post">
                <input type="text" name="username">
                <input type="password" name="password">
                <button type="submit">Sign In</button>
              </form>
            </body></html>
            """, "https://portal.example.com/account");

        LoginDetection detection = detector.detect(document, "https://portal.example.com/account");

        assertThat(detection.loginPage()).isTrue();
        assertThat(detection.loginMethod()).isEqualTo(LoginMethod.FORM);
        assertThat(detection.suggestedFields().usernameSelector()).isEqualTo("[name=username]");
        assertThat(detection.suggestedFields().passwordSelector()).isEqualTo("[name=password]");
        assertThat(detection.suggestedFields().submitSelector()).isEqualTo("button[type=submit]");
        assertThat(detection.suggestedFields().formSelector()).isEqualTo("#login-form");
        assertThat(detection.canSubmitForm()).isTrue();
        assertThat(detection.error()).isNull();
    }

    @Test
    void contentMentioningLoginWithoutPasswordFieldIsNotALoginPage() {
        Document document = Jsoup.parse("""
            <html><head><title>Release notes</title></head><body>
              <p>We improved the login experience and password reset emails.</p>
            </body></html>
            """, "https://example.com/blog/release");

        LoginDetection detection = detector.detect(document, "https://example.com/blog/release");

        assertThat(detection.loginPage()).isFalse();
    }

    @Test
    void samlLoginPathIsNotAutomatable() {
        Document document = Jsoup.parse("""
            <html><head><title>Redirecting</title></head><body>
              <p>Continue with Single Sign-On through your identity provider.</p>
            </body></html>
            """, "https://intranet.example.com/sso/start");

        LoginDetection detection = detector.detect(document, "https://intranet.example.com/sso/start");

        assertThat(detection.loginPage()).isTrue();
        assertThat(detection.loginMethod()).isEqualTo(LoginMethod.SAML);
        assertThat(detection.canSubmitForm()).isFalse();
        assertThat(detection.error()).isEqualTo("Login method \"saml\" is not supported for automated authentication.");
    }

    @Test
    void usesSiteSpecificSelectorsForKnownHosts() {
        Document document = Jsoup.parse("""
            <html><head><title>Sign in to SAP</title></head><body>
              <form id="logonForm" method="post">
                <input id="j_username" name="j_username" type="text">
                <input id="j_password" name="j_password" type="password">
                <button id="logOnFormSubmit" type="submit">Log On</button>
              </form>
            </body></html>
            """, "https://launchpad.support.sap.com/");

        LoginDetection detection = detector.detect(document, "https://launchpad.support.sap.com/");

        assertThat(detection.loginMethod()).isEqualTo(LoginMethod.FORM);
        assertThat(detection.suggestedFields().usernameSelector()).isEqualTo("#j_username");
        assertThat(detection.suggestedFields().passwordSelector()).isEqualTo("#j_password");
        assertThat(detection.suggestedFields().submitSelector()).isEqualTo("#logOnFormSubmit");
        assertThat(detection.suggestedFields().formSelector()).isEqualTo("#logonForm");
    }

    @Test
    void nullDocumentIsNotALoginPage() {
        assertThat(detector.detect(null, "https://example.com/login").loginPage()).isFalse();
    }
}
