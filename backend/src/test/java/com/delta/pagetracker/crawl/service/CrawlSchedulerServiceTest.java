package com.delta.pagetracker.crawl.service;

import com.delta.pagetracker.config.CrawlerProperties;
import com.delta.pagetracker.crawl.model.CrawlJob;
import com.delta.pagetracker.crawl.model.JobStatus;
import com.delta.pagetracker.crawl.model.SchedulerStatus;
import com.delta.pagetracker.crawl.persistence.CrawlJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CrawlSchedulerServiceTest {
    private CrawlJdbcRepository repository;
    private CrawlJobExecutor executor;
    private TaskScheduler taskScheduler;
    private CrawlerProperties properties;
    private CrawlSchedulerService scheduler;

    @BeforeEach
    void setUp() {
        repository = Mockito.mock(CrawlJdbcRepository.class);
        executor = Mockito.mock(CrawlJobExecutor.class);
        taskScheduler = Mockito.mock(TaskScheduler.class);
        properties = new CrawlerProperties();
        scheduler = new CrawlSchedulerService(repository, executor, taskScheduler, properties);
    }

    @Test
    void registersCronTriggerWithSecondsFieldAndStoresNextRun() {
        ScheduledFuture<?> future = Mockito.mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));

        boolean scheduled = scheduler.scheduleJob(job(1L, "*/15 * * * *", true));

        assertThat(scheduled).isTrue();
        ArgumentCaptor<Trigger> trigger = ArgumentCaptor.forClass(Trigger.class);
        verify(taskScheduler).schedule(any(Runnable.class), trigger.capture());
        assertThat(((CronTrigger) trigger.getValue()).getExpression()).isEqualTo("0 */15 * * * *");
        verify(repository).updateNextRun(eq(1L), any(Instant.class));
        assertThat(scheduler.getStatus().scheduledJobs()).containsExactly(1L);
    }

    @Test
    void reschedulingCancelsThePreviousTrigger() {
        ScheduledFuture<?> first = Mockito.mock(ScheduledFuture.class);
        ScheduledFuture<?> second = Mockito.mock(ScheduledFuture.class);
        doReturn(first).doReturn(second).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));

        scheduler.scheduleJob(job(1L, "0 9 * * *", true));
        scheduler.scheduleJob(job(1L, "0 10 * * *", true));

        verify(first).cancel(false);
        verify(second, never()).cancel(false);
        assertThat(scheduler.getStatus().scheduledJobsCount()).isEqualTo(1);
    }

    @Test
    void invalidScheduleIsSkipped() {
        assertThat(scheduler.scheduleJob(job(1L, "not a cron", true))).isFalse();

        verify(taskScheduler, never()).schedule(any(Runnable.class), any(Trigger.class));
        verify(repository, never()).updateNextRun(anyLong(), any());
    }

    @Test
    void inactiveJobIsUnscheduled() {
        ScheduledFuture<?> future = Mockito.mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        scheduler.scheduleJob(job(1L, "0 9 * * *", true));

        assertThat(scheduler.scheduleJob(job(1L, "0 9 * * *", false))).isFalse();

        verify(future).cancel(false);
        assertThat(scheduler.getStatus().scheduledJobs()).isEmpty();
    }

    @Test
    void initializeRegistersEveryValidActiveJob() {
        ScheduledFuture<?> future = Mockito.mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        when(repository.findActiveJobs()).thenReturn(List.of(
            job(1L, "0 9 * * *", true),
            job(2L, "bogus", true),
            job(3L, "30 2 * * 1", true)
        ));
        when(executor.runningJobIds()).thenReturn(List.of(3L));

        scheduler.onApplicationReady();
        scheduler.initialize();

        SchedulerStatus status = scheduler.getStatus();
        assertThat(status.initialized()).isTrue();
        assertThat(status.scheduledJobs()).containsExactly(1L, 3L);
        assertThat(status.runningJobs()).containsExactly(3L);
        verify(repository).findActiveJobs();
    }

    @Test
    void disabledSchedulerRegistersNothingOnStartup() {
        properties.getScheduler().setEnabled(false);

        scheduler.onApplicationReady();

        assertThat(scheduler.isInitialized()).isFalse();
        verify(repository, never()).findActiveJobs();
    }

    @Test
    void reloadReplacesAllTriggers() {
        ScheduledFuture<?> future = Mockito.mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        when(repository.findActiveJobs())
            .thenReturn(List.of(job(1L, "0 9 * * *", true)))
            .thenReturn(List.of(job(2L, "0 9 * * *", true)));

        scheduler.initialize();
        int registered = scheduler.reloadJobs();

        assertThat(registered).isEqualTo(1);
        verify(future).cancel(false);
        assertThat(scheduler.getStatus().scheduledJobs()).containsExactly(2L);
    }

    @Test
    void firingSkipsOverlappingRunAndDropsDeletedJobs() {
        ScheduledFuture<?> future = Mockito.mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        scheduler.scheduleJob(job(1L, "0 9 * * *", true));
        scheduler.scheduleJob(job(2L, "0 9 * * *", true));
        when(executor.startAsync(1L)).thenThrow(new ActiveCrawlRunException(1L));
        when(executor.startAsync(2L)).thenThrow(JobNotFoundException.job(2L));

        scheduler.fire(1L);
        scheduler.fire(2L);

        assertThat(scheduler.getStatus().scheduledJobs()).containsExactly(1L);
        verify(executor, never()).executeJob(anyLong());
    }

    @Test
    void firingHandsRunToExecutorWithoutWaiting() {
        when(executor.startAsync(3L)).thenReturn(Optional.empty());

        scheduler.fire(3L);

        verify(executor).startAsync(3L);
        verify(executor, never()).executeJob(anyLong());
    }

    @Test
    void shutdownCancelsEveryTrigger() {
        ScheduledFuture<?> future = Mockito.mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        when(repository.findActiveJobs()).thenReturn(List.of(job(1L, "0 9 * * *", true)));
        scheduler.initialize();

        scheduler.shutdown();

        verify(future).cancel(false);
        assertThat(scheduler.isInitialized()).isFalse();
        assertThat(scheduler.getStatus().scheduledJobsCount()).isZero();
    }

    private static CrawlJob job(long id, String schedule, boolean active) {
        Instant now = Instant.parse("2024-03-04T09:00:00Z");
        return new CrawlJob(id, "tenant-a", "Job " + id, "https://acme.com/", schedule, null, 2, null,
            List.of(), List.of(), null, active, JobStatus.IDLE, null, null, now, now);
    }
}
