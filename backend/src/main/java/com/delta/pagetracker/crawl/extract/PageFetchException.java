package com.delta.pagetracker.crawl.extract;

public class PageFetchException extends RuntimeException {
    private final String url;
    private final Integer statusCode;
    private final String reasonCode;

    public PageFetchException(String url, Integer statusCode, String reasonCode, String message) {
        super(message);
        this.url = url;
        this.statusCode = statusCode;
        this.reasonCode = reasonCode;
    }

    public String getUrl() {
        return url;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
