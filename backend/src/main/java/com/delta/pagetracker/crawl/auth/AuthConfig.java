package com.delta.pagetracker.crawl.auth;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decrypted credential material for one crawl run. Instances live only for the duration of a run
 * and every variant redacts its secrets from {@code toString()}.
 */
public sealed interface AuthConfig
    permits AuthConfig.Basic, AuthConfig.Header, AuthConfig.Cookie, AuthConfig.Form, AuthConfig.Sso {

    AuthKind kind();

    record Basic(String username, String password) implements AuthConfig {
        @Override
        public AuthKind kind() {
            return AuthKind.BASIC;
        }

        @Override
        public String toString() {
            return "Basic[username=" + username + ", password=***]";
        }
    }

    record Header(Map<String, String> headers) implements AuthConfig {
        public Header {
            headers = headers == null ? Map.of() : new LinkedHashMap<>(headers);
        }

        @Override
        public AuthKind kind() {
            return AuthKind.HEADER;
        }

        @Override
        public String toString() {
            return "Header[names=" + headers.keySet() + "]";
        }
    }

    record Cookie(List<CookieEntry> cookies) implements AuthConfig {
        public Cookie {
            cookies = cookies == null ? List.of() : List.copyOf(cookies);
        }

        @Override
        public AuthKind kind() {
            return AuthKind.COOKIE;
        }

        @Override
        public String toString() {
            return "Cookie[names=" + cookies.stream().map(CookieEntry::name).toList() + "]";
        }
    }

    record Form(
        String username,
        String password,
        String formSelector,
        String usernameField,
        String passwordField,
        String submitButton,
        String loginUrl
    ) implements AuthConfig {
        @Override
        public AuthKind kind() {
            return AuthKind.FORM;
        }

        @Override
        public String toString() {
            return "Form[username=" + username + ", password=***, formSelector=" + formSelector
                + ", loginUrl=" + loginUrl + "]";
        }
    }

    record Sso(String provider, String token) implements AuthConfig {
        @Override
        public AuthKind kind() {
            return AuthKind.SSO;
        }

        @Override
        public String toString() {
            return "Sso[provider=" + provider + "]";
        }
    }

    record CookieEntry(String name, String value, String domain, String path) {
        @Override
        public String toString() {
            return "CookieEntry[name=" + name + ", domain=" + domain + ", path=" + path + "]";
        }
    }
}
