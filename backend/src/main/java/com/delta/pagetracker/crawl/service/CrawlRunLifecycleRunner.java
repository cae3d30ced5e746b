package com.delta.pagetracker.crawl.service;

import com.delta.pagetracker.config.CrawlerProperties;
import com.delta.pagetracker.crawl.model.CrawlJob;
import com.delta.pagetracker.crawl.model.JobRun;
import com.delta.pagetracker.crawl.model.JobStatus;
import com.delta.pagetracker.crawl.persistence.CrawlJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

@Component
public class CrawlRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlRunLifecycleRunner.class);
    static final String ABORTED_ON_STARTUP = "aborted_on_startup";

    private final CrawlJdbcRepository repository;
    private final CrawlerProperties properties;

    public CrawlRunLifecycleRunner(CrawlJdbcRepository repository, CrawlerProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping crawl run cleanup because database is unreachable");
            return;
        }
        recoverInterruptedRuns(Instant.now());
    }

    /**
     * Runs do not survive a restart, so every run still marked running is failed and every job
     * still claimed is released.
     */
    int recoverInterruptedRuns(Instant now) {
        int aborted = 0;
        for (JobRun run : repository.findRunningRuns()) {
            if (!repository.failRun(run.id(), ABORTED_ON_STARTUP, run.logs(), now)) {
                continue;
            }
            aborted++;
            releaseJob(run.jobId(), now);
            log.info("Aborted interrupted run={} job={} startedAt={}", run.id(), run.jobId(), run.startedAt());
        }
        for (CrawlJob job : repository.findJobsStuckRunning()) {
            releaseJob(job.id(), now);
            log.info("Released job={} left running without an open run", job.id());
        }
        return aborted;
    }

    private void releaseJob(long jobId, Instant now) {
        Optional<CrawlJob> job = repository.findJob(jobId);
        Instant nextRun = job
            .map(j -> CronSchedules.nextRun(j.schedule(), ZoneId.of(properties.getScheduler().getZone()), now))
            .orElse(null);
        repository.finishJob(jobId, JobStatus.FAILED, now, nextRun);
    }
}
