package com.delta.pagetracker.crawl.model;

import java.util.Locale;

public enum JobStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return IDLE;
        }
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
