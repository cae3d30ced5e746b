package com.delta.pagetracker.crawl.model;

import java.util.Locale;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RunStatus fromValue(String value) {
        return RunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
