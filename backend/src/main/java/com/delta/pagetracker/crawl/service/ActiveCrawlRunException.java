package com.delta.pagetracker.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveCrawlRunException extends RuntimeException {
    private final long jobId;

    public ActiveCrawlRunException(long jobId) {
        super("Job " + jobId + " already has a run in progress");
        this.jobId = jobId;
    }

    public long getJobId() {
        return jobId;
    }
}
