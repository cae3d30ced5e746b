package com.delta.pagetracker.crawl.auth;

public record AuthErrorAssessment(
    boolean authError,
    boolean needsCredentials,
    String loginMethod,
    String suggestion
) {
    public static AuthErrorAssessment notAuthError() {
        return new AuthErrorAssessment(false, false, null, null);
    }
}
