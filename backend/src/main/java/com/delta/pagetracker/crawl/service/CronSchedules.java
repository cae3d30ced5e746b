package com.delta.pagetracker.crawl.service;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

public final class CronSchedules {

    private CronSchedules() {
    }

    public static String toSpringExpression(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("cron expression is required");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException(
                "cron expression must have 5 fields (minute hour day month weekday): " + expression);
        }
        return "0 " + String.join(" ", fields);
    }

    public static CronExpression parse(String expression) {
        return CronExpression.parse(toSpringExpression(expression));
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Next fire time strictly after {@code from}, or null when the expression is invalid or never fires.
     */
    public static Instant nextRun(String expression, ZoneId zone, Instant from) {
        CronExpression cron;
        try {
            cron = parse(expression);
        } catch (IllegalArgumentException e) {
            return null;
        }
        ZonedDateTime next = cron.next(from.atZone(zone));
        return next == null ? null : next.toInstant();
    }
}
