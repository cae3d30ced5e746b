package com.delta.pagetracker.crawl.auth;

public class AuthenticationException extends RuntimeException {
    private final String loginMethod;

    public AuthenticationException(String message) {
        this(message, null, null);
    }

    public AuthenticationException(String message, String loginMethod) {
        this(message, loginMethod, null);
    }

    public AuthenticationException(String message, String loginMethod, Throwable cause) {
        super(message, cause);
        this.loginMethod = loginMethod;
    }

    public String getLoginMethod() {
        return loginMethod;
    }
}
