package com.delta.pagetracker.crawl.auth;

import java.util.Locale;

public enum AuthKind {
    BASIC,
    FORM,
    COOKIE,
    HEADER,
    SSO;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AuthKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("auth kind is required");
        }
        return AuthKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
