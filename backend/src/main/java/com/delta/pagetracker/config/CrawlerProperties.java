package com.delta.pagetracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "delta-page-tracker/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 250;
    private int globalConcurrency = 8;
    private int perHostConcurrency = 2;
    private int requestTimeoutSeconds = 30;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private int defaultMaxPages = 100;
    private int defaultDelayMs = 1000;
    private Scheduler scheduler = new Scheduler();
    private Versioning versioning = new Versioning();
    private Credentials credentials = new Credentials();
    private Embedding embedding = new Embedding();
    private Robots robots = new Robots();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = globalConcurrency;
    }

    public int getPerHostConcurrency() {
        return Math.max(1, perHostConcurrency);
    }

    public void setPerHostConcurrency(int perHostConcurrency) {
        this.perHostConcurrency = perHostConcurrency;
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = requestMaxRetries;
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public int getDefaultMaxPages() {
        return Math.max(1, defaultMaxPages);
    }

    public void setDefaultMaxPages(int defaultMaxPages) {
        this.defaultMaxPages = Math.max(1, defaultMaxPages);
    }

    public int getDefaultDelayMs() {
        return Math.max(0, defaultDelayMs);
    }

    public void setDefaultDelayMs(int defaultDelayMs) {
        this.defaultDelayMs = Math.max(0, defaultDelayMs);
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Versioning getVersioning() {
        return versioning;
    }

    public void setVersioning(Versioning versioning) {
        this.versioning = versioning;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public void setCredentials(Credentials credentials) {
        this.credentials = credentials;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public void setEmbedding(Embedding embedding) {
        this.embedding = embedding;
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int poolSize = 4;
        private String zone = "UTC";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPoolSize() {
            return Math.max(1, poolSize);
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = Math.max(1, poolSize);
        }

        public String getZone() {
            return zone == null || zone.isBlank() ? "UTC" : zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }

    public static class Versioning {
        private double significantChangePercent = 5.0;

        public double getSignificantChangePercent() {
            return Math.max(0.0, significantChangePercent);
        }

        public void setSignificantChangePercent(double significantChangePercent) {
            this.significantChangePercent = significantChangePercent;
        }
    }

    public static class Credentials {
        private String encryptionKey = "default-key-change-this";
        private String salt = "5c0744940b5c369b";

        public String getEncryptionKey() {
            return encryptionKey;
        }

        public void setEncryptionKey(String encryptionKey) {
            this.encryptionKey = encryptionKey;
        }

        public String getSalt() {
            return salt;
        }

        public void setSalt(String salt) {
            this.salt = salt;
        }
    }

    public static class Embedding {
        private String endpoint;
        private int timeoutSeconds = 30;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public boolean isEnabled() {
            return endpoint != null && !endpoint.isBlank();
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Robots {
        private boolean failOpen = true;

        public boolean isFailOpen() {
            return failOpen;
        }

        public void setFailOpen(boolean failOpen) {
            this.failOpen = failOpen;
        }
    }
}
