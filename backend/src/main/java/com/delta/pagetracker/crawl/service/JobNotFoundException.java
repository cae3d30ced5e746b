package com.delta.pagetracker.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String message) {
        super(message);
    }

    public static JobNotFoundException job(long jobId) {
        return new JobNotFoundException("Crawl job " + jobId + " not found");
    }
}
