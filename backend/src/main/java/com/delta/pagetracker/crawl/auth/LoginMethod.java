package com.delta.pagetracker.crawl.auth;

import java.util.Locale;

public enum LoginMethod {
    FORM,
    SAML,
    OAUTH,
    UNKNOWN;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
