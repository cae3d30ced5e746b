package com.delta.pagetracker.crawl.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One entry of a run's error log. Field names are part of the persisted {@code logs} contract.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CrawlError(
    String url,
    String error,
    Boolean needsCredentials,
    String loginMethod
) {
    public static CrawlError of(String url, String error) {
        return new CrawlError(url, error, null, null);
    }
}
