package com.delta.pagetracker.crawl.model;

import java.util.Locale;

public enum ChangeType {
    CREATED,
    UPDATED,
    DELETED,
    TITLE_CHANGED,
    CONTENT_CHANGED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChangeType fromValue(String value) {
        return ChangeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
