package com.delta.pagetracker.crawl.service;

import com.delta.pagetracker.config.CrawlerProperties;
import com.delta.pagetracker.crawl.model.CrawlJob;
import com.delta.pagetracker.crawl.model.SchedulerStatus;
import com.delta.pagetracker.crawl.persistence.CrawlJdbcRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

@Service
public class CrawlSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(CrawlSchedulerService.class);

    private final CrawlJdbcRepository repository;
    private final CrawlJobExecutor executor;
    private final TaskScheduler taskScheduler;
    private final CrawlerProperties properties;
    private final Map<Long, ScheduledFuture<?>> triggers = new ConcurrentHashMap<>();
    private volatile boolean initialized;

    public CrawlSchedulerService(
        CrawlJdbcRepository repository,
        CrawlJobExecutor executor,
        @Qualifier("crawlTriggerScheduler") TaskScheduler taskScheduler,
        CrawlerProperties properties
    ) {
        this.repository = repository;
        this.executor = executor;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("Crawl scheduler disabled (crawler.scheduler.enabled=false)");
            return;
        }
        initialize();
    }

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        int registered = registerActiveJobs();
        initialized = true;
        log.info("Crawl scheduler initialized with {} job(s)", registered);
    }

    public boolean scheduleJob(CrawlJob job) {
        unscheduleJob(job.id());
        if (!job.active()) {
            return false;
        }
        ZoneId zone = zone();
        CronTrigger trigger;
        try {
            trigger = new CronTrigger(CronSchedules.toSpringExpression(job.schedule()), zone);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping job={} with invalid schedule '{}': {}", job.id(), job.schedule(), e.getMessage());
            return false;
        }
        long jobId = job.id();
        ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(jobId), trigger);
        if (future == null) {
            log.warn("Schedule '{}' for job={} never fires", job.schedule(), jobId);
            return false;
        }
        triggers.put(jobId, future);
        repository.updateNextRun(jobId, CronSchedules.nextRun(job.schedule(), zone, Instant.now()));
        log.info("Scheduled job={} cron='{}' zone={}", jobId, job.schedule(), zone);
        return true;
    }

    public boolean unscheduleJob(long jobId) {
        ScheduledFuture<?> previous = triggers.remove(jobId);
        if (previous == null) {
            return false;
        }
        previous.cancel(false);
        log.debug("Unscheduled job={}", jobId);
        return true;
    }

    public synchronized int reloadJobs() {
        cancelAll();
        int registered = registerActiveJobs();
        initialized = true;
        log.info("Reloaded crawl schedules: {} job(s) registered", registered);
        return registered;
    }

    public SchedulerStatus getStatus() {
        List<Long> scheduled = new ArrayList<>(triggers.keySet());
        scheduled.sort(Long::compare);
        return new SchedulerStatus(initialized, scheduled.size(), scheduled, executor.runningJobIds());
    }

    public boolean isInitialized() {
        return initialized;
    }

    @PreDestroy
    public synchronized void shutdown() {
        int count = triggers.size();
        cancelAll();
        initialized = false;
        log.info("Crawl scheduler stopped; {} trigger(s) cancelled", count);
    }

    // Trigger threads only claim; the crawl itself runs on the run executor.
    void fire(long jobId) {
        try {
            executor.startAsync(jobId);
        } catch (ActiveCrawlRunException e) {
            log.warn("Scheduled trigger skipped job={}: {}", jobId, e.getMessage());
        } catch (JobNotFoundException e) {
            log.warn("Scheduled job={} no longer exists; removing trigger", jobId);
            unscheduleJob(jobId);
        } catch (RuntimeException e) {
            log.error("Scheduled run failed job={}", jobId, e);
        }
    }

    private int registerActiveJobs() {
        int registered = 0;
        for (CrawlJob job : repository.findActiveJobs()) {
            if (scheduleJob(job)) {
                registered++;
            }
        }
        return registered;
    }

    private void cancelAll() {
        for (ScheduledFuture<?> future : triggers.values()) {
            future.cancel(false);
        }
        triggers.clear();
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getScheduler().getZone());
    }
}
