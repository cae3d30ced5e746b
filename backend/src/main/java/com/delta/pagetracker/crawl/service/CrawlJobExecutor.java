package com.delta.pagetracker.crawl.service;

import com.delta.pagetracker.config.CrawlerProperties;
import com.delta.pagetracker.crawl.auth.AuthConfig;
import com.delta.pagetracker.crawl.auth.CredentialCipher;
import com.delta.pagetracker.crawl.change.DocumentVersioner;
import com.delta.pagetracker.crawl.change.VersioningOutcome;
import com.delta.pagetracker.crawl.model.CrawlError;
import com.delta.pagetracker.crawl.model.CrawlJob;
import com.delta.pagetracker.crawl.model.CrawlResult;
import com.delta.pagetracker.crawl.model.CredentialDescriptor;
import com.delta.pagetracker.crawl.model.JobRun;
import com.delta.pagetracker.crawl.model.JobRunTally;
import com.delta.pagetracker.crawl.model.JobStatus;
import com.delta.pagetracker.crawl.model.ScrapedPage;
import com.delta.pagetracker.crawl.persistence.CrawlJdbcRepository;
import com.delta.pagetracker.crawl.template.TemplateCatalog;
import com.delta.pagetracker.crawl.template.WebsiteTemplate;
import com.delta.pagetracker.crawl.traversal.CrawlCancellation;
import com.delta.pagetracker.crawl.traversal.CrawlOptions;
import com.delta.pagetracker.crawl.traversal.CrawlTraversalEngine;
import com.delta.pagetracker.crawl.traversal.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a crawl job end to end. A job holds at most one run at a time.
 */
@Service
public class CrawlJobExecutor {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobExecutor.class);
    static final String CANCELLED_MESSAGE = "Run cancelled by operator";

    private final CrawlJdbcRepository repository;
    private final CredentialCipher credentialCipher;
    private final TemplateCatalog templateCatalog;
    private final CrawlTraversalEngine traversalEngine;
    private final DocumentVersioner versioner;
    private final CrawlerProperties properties;
    private final ExecutorService runExecutor;
    private final Clock clock;
    private final Map<Long, CrawlCancellation> activeRuns = new ConcurrentHashMap<>();

    @Autowired
    public CrawlJobExecutor(
        CrawlJdbcRepository repository,
        CredentialCipher credentialCipher,
        TemplateCatalog templateCatalog,
        CrawlTraversalEngine traversalEngine,
        DocumentVersioner versioner,
        CrawlerProperties properties,
        @Qualifier("crawlRunExecutor") ExecutorService runExecutor
    ) {
        this(repository, credentialCipher, templateCatalog, traversalEngine, versioner, properties, runExecutor,
            Clock.systemUTC());
    }

    CrawlJobExecutor(
        CrawlJdbcRepository repository,
        CredentialCipher credentialCipher,
        TemplateCatalog templateCatalog,
        CrawlTraversalEngine traversalEngine,
        DocumentVersioner versioner,
        CrawlerProperties properties,
        ExecutorService runExecutor,
        Clock clock
    ) {
        this.repository = repository;
        this.credentialCipher = credentialCipher;
        this.templateCatalog = templateCatalog;
        this.traversalEngine = traversalEngine;
        this.versioner = versioner;
        this.properties = properties;
        this.runExecutor = runExecutor;
        this.clock = clock;
    }

    public Optional<JobRun> executeJob(long jobId) {
        Optional<RunClaim> claim = claim(jobId);
        if (claim.isEmpty()) {
            return Optional.empty();
        }
        run(claim.get());
        return repository.findRun(claim.get().runId());
    }

    public Optional<JobRun> startAsync(long jobId) {
        Optional<RunClaim> claim = claim(jobId);
        if (claim.isEmpty()) {
            return Optional.empty();
        }
        RunClaim runClaim = claim.get();
        try {
            runExecutor.submit(() -> run(runClaim));
        } catch (RejectedExecutionException e) {
            activeRuns.remove(jobId, runClaim.cancellation());
            closeFailed(runClaim, "Run executor rejected the run: " + e.getMessage(), List.of());
            throw e;
        }
        return repository.findRun(runClaim.runId());
    }

    public boolean cancel(long jobId) {
        CrawlCancellation token = activeRuns.get(jobId);
        if (token == null) {
            return false;
        }
        log.info("Cancellation requested job={}", jobId);
        token.cancel();
        return true;
    }

    public boolean isRunning(long jobId) {
        return activeRuns.containsKey(jobId);
    }

    public List<Long> runningJobIds() {
        return activeRuns.keySet().stream().sorted().toList();
    }

    private Optional<RunClaim> claim(long jobId) {
        CrawlJob job = repository.findJob(jobId).orElseThrow(() -> JobNotFoundException.job(jobId));
        if (!job.active()) {
            log.info("Skipping inactive job={}", jobId);
            return Optional.empty();
        }
        Instant startedAt = clock.instant();
        if (!repository.tryMarkJobRunning(jobId, startedAt)) {
            log.warn("Rejected run for job={}; a run is already in progress", jobId);
            throw new ActiveCrawlRunException(jobId);
        }
        long runId;
        try {
            runId = repository.insertRun(jobId, job.tenantId(), startedAt);
        } catch (RuntimeException e) {
            repository.finishJob(jobId, JobStatus.FAILED, startedAt, nextRun(job, startedAt));
            throw e;
        }
        CrawlCancellation cancellation = new CrawlCancellation();
        activeRuns.put(jobId, cancellation);
        log.info("Started run job={} run={} url={}", jobId, runId, job.baseUrl());
        return Optional.of(new RunClaim(job, runId, cancellation));
    }

    private void run(RunClaim claim) {
        CrawlJob job = claim.job();
        List<CrawlError> logs = new ArrayList<>();
        try {
            AuthConfig authConfig = resolveCredential(job);
            TemplateChoice templateChoice = resolveTemplate(job);
            int maxPages = job.maxPages() != null ? job.maxPages() : properties.getDefaultMaxPages();
            CrawlOptions options = CrawlOptions.forJob(
                job.maxDepth(),
                maxPages,
                job.includePatterns(),
                job.excludePatterns(),
                templateChoice.template(),
                templateChoice.explicit(),
                properties.getDefaultDelayMs()
            );

            CrawlResult result = traversalEngine.crawl(
                job.baseUrl(), options, templateChoice.template(), authConfig, claim.cancellation());
            logs.addAll(result.errors());

            int created = 0;
            int updated = 0;
            for (ScrapedPage page : result.pages()) {
                try {
                    VersioningOutcome outcome = versioner.applyVersioning(job.tenantId(), job.id(), claim.runId(), page);
                    if (outcome.created()) {
                        created++;
                    } else if (outcome.updated()) {
                        updated++;
                    }
                } catch (RuntimeException e) {
                    log.warn("Versioning failed job={} run={} url={}", job.id(), claim.runId(), page.url(), e);
                    logs.add(CrawlError.of(page.url(), "Versioning failed: " + e.getMessage()));
                }
            }

            if (result.summary().cancelled()) {
                closeFailed(claim, CANCELLED_MESSAGE, logs);
                return;
            }
            Optional<CrawlError> seedError = seedFailure(job, result);
            if (seedError.isPresent()) {
                closeFailed(claim, seedError.get().error(), logs);
                return;
            }

            JobRunTally tally = new JobRunTally(
                result.summary().totalPages(),
                result.pages().size(),
                result.errors().size(),
                created,
                updated,
                created + updated
            );
            Instant completedAt = clock.instant();
            repository.completeRun(claim.runId(), tally, logs, completedAt);
            Instant next = nextRun(job, completedAt);
            repository.finishJob(job.id(), JobStatus.COMPLETED, completedAt, next);
            log.info(
                "Completed run job={} run={} processed={} ok={} failed={} created={} updated={} nextRun={}",
                job.id(), claim.runId(), tally.urlsProcessed(), tally.urlsSuccessful(), tally.urlsFailed(),
                created, updated, next
            );
        } catch (RuntimeException e) {
            log.error("Run failed job={} run={}", job.id(), claim.runId(), e);
            closeFailed(claim, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), logs);
        } catch (Error e) {
            log.error("Run aborted job={} run={}", job.id(), claim.runId(), e);
            closeFailed(claim, e.getClass().getSimpleName(), logs);
            throw e;
        } finally {
            activeRuns.remove(job.id(), claim.cancellation());
        }
    }

    // Auth errors carry needsCredentials and leave the run completed; any other seed error fails it.
    private static Optional<CrawlError> seedFailure(CrawlJob job, CrawlResult result) {
        String seedKey = UrlNormalizer.dedupKey(job.baseUrl());
        return result.errors().stream()
            .filter(error -> error.needsCredentials() == null)
            .filter(error -> Objects.equals(seedKey, UrlNormalizer.dedupKey(error.url())))
            .findFirst();
    }

    private void closeFailed(RunClaim claim, String message, List<CrawlError> logs) {
        Instant completedAt = clock.instant();
        try {
            repository.failRun(claim.runId(), message, logs, completedAt);
        } finally {
            Instant next = nextRun(claim.job(), completedAt);
            repository.finishJob(claim.job().id(), JobStatus.FAILED, completedAt, next);
            log.warn("Run failed job={} run={} error={} nextRun={}", claim.job().id(), claim.runId(), message, next);
        }
    }

    private AuthConfig resolveCredential(CrawlJob job) {
        if (job.credentialId() == null) {
            return null;
        }
        CredentialDescriptor credential = repository.findCredential(job.credentialId())
            .filter(c -> c.tenantId().equals(job.tenantId()))
            .orElseThrow(() -> new IllegalStateException("Credential " + job.credentialId() + " not found"));
        if (!credential.active()) {
            throw new IllegalStateException("Credential " + credential.id() + " is inactive");
        }
        return credentialCipher.decrypt(credential.encryptedPayload(), credential.authKind());
    }

    private TemplateChoice resolveTemplate(CrawlJob job) {
        if (job.templateId() != null && !job.templateId().isBlank()) {
            WebsiteTemplate template = templateCatalog.getTemplateById(job.templateId())
                .orElseThrow(() -> new IllegalStateException("Unknown template " + job.templateId()));
            return new TemplateChoice(template, true);
        }
        return new TemplateChoice(templateCatalog.suggestTemplateForUrl(job.baseUrl()), false);
    }

    private Instant nextRun(CrawlJob job, Instant from) {
        ZoneId zone = ZoneId.of(properties.getScheduler().getZone());
        return CronSchedules.nextRun(job.schedule(), zone, from);
    }

    private record RunClaim(CrawlJob job, long runId, CrawlCancellation cancellation) {
    }

    private record TemplateChoice(WebsiteTemplate template, boolean explicit) {
    }
}
