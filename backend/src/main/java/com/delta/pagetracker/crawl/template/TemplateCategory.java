package com.delta.pagetracker.crawl.template;

import java.util.Locale;

public enum TemplateCategory {
    DOCUMENTATION,
    ECOMMERCE,
    NEWS,
    CORPORATE,
    BLOG,
    WIKI,
    SOCIAL,
    CUSTOM;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TemplateCategory fromValue(String value) {
        return TemplateCategory.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
