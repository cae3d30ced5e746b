package com.delta.pagetracker.crawl.model;

public record AuthenticationAttempts(int sso, int credentials, int failed) {
    public static AuthenticationAttempts none() {
        return new AuthenticationAttempts(0, 0, 0);
    }
}
