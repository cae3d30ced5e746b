package com.delta.pagetracker.crawl.model;

import java.util.List;

public record SchedulerStatus(
    boolean initialized,
    int scheduledJobsCount,
    List<Long> scheduledJobs,
    List<Long> runningJobs
) {
}
