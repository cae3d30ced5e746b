package com.delta.pagetracker.crawl.service;

import com.delta.pagetracker.config.CrawlerProperties;
import com.delta.pagetracker.crawl.auth.AuthConfig;
import com.delta.pagetracker.crawl.auth.AuthKind;
import com.delta.pagetracker.crawl.auth.CredentialCipher;
import com.delta.pagetracker.crawl.model.CrawlJob;
import com.delta.pagetracker.crawl.model.CrawlJobRequest;
import com.delta.pagetracker.crawl.model.CredentialDescriptor;
import com.delta.pagetracker.crawl.model.CredentialRequest;
import com.delta.pagetracker.crawl.model.CredentialView;
import com.delta.pagetracker.crawl.model.JobRun;
import com.delta.pagetracker.crawl.persistence.CrawlJdbcRepository;
import com.delta.pagetracker.crawl.template.TemplateCatalog;
import com.delta.pagetracker.crawl.traversal.UrlFilter;
import com.delta.pagetracker.crawl.traversal.UrlNormalizer;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;

@Service
public class CrawlJobService {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobService.class);
    static final int DEFAULT_MAX_DEPTH = 2;
    static final int MAX_DEPTH_LIMIT = 10;
    static final int MAX_PAGES_LIMIT = 10_000;
    private static final int MAX_NAME_LENGTH = 255;

    private final CrawlJdbcRepository repository;
    private final CrawlSchedulerService scheduler;
    private final CrawlJobExecutor executor;
    private final TemplateCatalog templateCatalog;
    private final CredentialCipher credentialCipher;
    private final CrawlerProperties properties;
    private final Clock clock;

    public CrawlJobService(
        CrawlJdbcRepository repository,
        CrawlSchedulerService scheduler,
        CrawlJobExecutor executor,
        TemplateCatalog templateCatalog,
        CredentialCipher credentialCipher,
        CrawlerProperties properties
    ) {
        this.repository = repository;
        this.scheduler = scheduler;
        this.executor = executor;
        this.templateCatalog = templateCatalog;
        this.credentialCipher = credentialCipher;
        this.properties = properties;
        this.clock = Clock.systemUTC();
    }

    public List<CrawlJob> listJobs(String tenantId) {
        return repository.findJobs(requireTenant(tenantId));
    }

    public CrawlJob getJob(String tenantId, long jobId) {
        return repository.findJob(jobId)
            .filter(job -> job.tenantId().equals(tenantId))
            .orElseThrow(() -> JobNotFoundException.job(jobId));
    }

    public CrawlJob saveJob(CrawlJobRequest request) {
        if (request == null) {
            throw new JobValidationException("job is required");
        }
        String tenantId = requireTenant(request.tenantId());
        if (request.id() != null) {
            getJob(tenantId, request.id());
        }
        CrawlJob candidate = validate(request, tenantId);
        Instant now = clock.instant();
        long jobId;
        if (request.id() == null) {
            jobId = repository.insertJob(candidate, now);
            log.info("Created job={} tenant={} url={}", jobId, tenantId, candidate.baseUrl());
        } else {
            jobId = request.id();
            repository.updateJob(candidate, now);
            log.info("Updated job={} tenant={}", jobId, tenantId);
        }
        CrawlJob saved = repository.findJob(jobId).orElseThrow(() -> JobNotFoundException.job(jobId));
        register(saved);
        return saved;
    }

    public CrawlJob setActive(String tenantId, long jobId, boolean active) {
        CrawlJob job = getJob(tenantId, jobId);
        CrawlJob toggled = new CrawlJob(
            job.id(), job.tenantId(), job.name(), job.baseUrl(), job.schedule(), job.templateId(), job.maxDepth(),
            job.maxPages(), job.includePatterns(), job.excludePatterns(), job.credentialId(), active, job.status(),
            job.lastRun(), active ? nextRun(job.schedule()) : null, job.createdAt(), job.updatedAt()
        );
        repository.updateJob(toggled, clock.instant());
        CrawlJob saved = repository.findJob(jobId).orElseThrow(() -> JobNotFoundException.job(jobId));
        register(saved);
        return saved;
    }

    public void deleteJob(String tenantId, long jobId) {
        getJob(tenantId, jobId);
        if (executor.isRunning(jobId)) {
            throw new ActiveCrawlRunException(jobId);
        }
        scheduler.unscheduleJob(jobId);
        repository.deleteJob(tenantId, jobId);
        log.info("Deleted job={} tenant={}", jobId, tenantId);
    }

    public JobRun runNow(String tenantId, long jobId) {
        getJob(tenantId, jobId);
        return executor.startAsync(jobId)
            .orElseThrow(() -> new JobValidationException("Job " + jobId + " is inactive"));
    }

    public boolean cancelRun(String tenantId, long jobId) {
        getJob(tenantId, jobId);
        return executor.cancel(jobId);
    }

    public List<JobRun> listRuns(String tenantId, long jobId, int limit) {
        getJob(tenantId, jobId);
        return repository.findRunsForJob(jobId, limit);
    }

    public JobRun getRun(String tenantId, long runId) {
        return repository.findRun(runId)
            .filter(run -> run.tenantId().equals(tenantId))
            .orElseThrow(() -> new JobNotFoundException("Job run " + runId + " not found"));
    }

    // ---- credentials ----

    public List<CredentialView> listCredentials(String tenantId) {
        return repository.findCredentials(requireTenant(tenantId)).stream()
            .map(CredentialDescriptor::toView)
            .toList();
    }

    public CredentialView saveCredential(CredentialRequest request) {
        if (request == null) {
            throw new JobValidationException("credential is required");
        }
        String tenantId = requireTenant(request.tenantId());
        String name = requireText(request.name(), "name");
        String domain = requireText(request.domain(), "domain").toLowerCase(Locale.ROOT);
        AuthKind kind;
        try {
            kind = AuthKind.fromValue(request.authKind());
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("unsupported auth kind: " + request.authKind());
        }
        boolean active = request.active() == null || request.active();

        String ciphertext = null;
        if (request.payload() != null && !request.payload().isNull()) {
            AuthConfig config;
            try {
                config = credentialCipher.readPayload(request.payload(), kind);
            } catch (IllegalArgumentException e) {
                throw new JobValidationException(e.getMessage());
            }
            ciphertext = credentialCipher.encrypt(config);
        }

        Instant now = clock.instant();
        long id;
        if (request.id() == null) {
            if (ciphertext == null) {
                throw new JobValidationException("credential payload is required");
            }
            id = repository.insertCredential(tenantId, name, domain, kind, ciphertext, active, now);
            log.info("Created credential={} tenant={} kind={} domain={}", id, tenantId, kind.value(), domain);
        } else {
            CredentialDescriptor existing = findCredential(tenantId, request.id());
            if (ciphertext == null && existing.authKind() != kind) {
                throw new JobValidationException("changing the auth kind requires a new payload");
            }
            id = existing.id();
            repository.updateCredential(id, tenantId, name, domain, kind, ciphertext, active, now);
            log.info("Updated credential={} tenant={} kind={}", id, tenantId, kind.value());
        }
        return findCredential(tenantId, id).toView();
    }

    public void deleteCredential(String tenantId, long credentialId) {
        findCredential(tenantId, credentialId);
        repository.deleteCredential(tenantId, credentialId);
        log.info("Deleted credential={} tenant={}", credentialId, tenantId);
    }

    CrawlJob validate(CrawlJobRequest request, String tenantId) {
        String name = requireText(request.name(), "name");
        if (name.length() > MAX_NAME_LENGTH) {
            throw new JobValidationException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        String baseUrl = requireText(request.baseUrl(), "baseUrl");
        if (UrlNormalizer.normalize(baseUrl) == null) {
            throw new JobValidationException("baseUrl must be an absolute http(s) URL: " + baseUrl);
        }
        String schedule = requireText(request.schedule(), "schedule");
        try {
            CronSchedules.parse(schedule);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("invalid schedule: " + e.getMessage());
        }
        String templateId = StringUtils.trimToNull(request.templateId());
        if (templateId != null && templateCatalog.getTemplateById(templateId).isEmpty()) {
            throw new JobValidationException("unknown template: " + templateId);
        }
        int maxDepth = request.maxDepth() == null ? DEFAULT_MAX_DEPTH : request.maxDepth();
        if (maxDepth < 0 || maxDepth > MAX_DEPTH_LIMIT) {
            throw new JobValidationException("maxDepth must be between 0 and " + MAX_DEPTH_LIMIT);
        }
        Integer maxPages = request.maxPages();
        if (maxPages != null && (maxPages < 1 || maxPages > MAX_PAGES_LIMIT)) {
            throw new JobValidationException("maxPages must be between 1 and " + MAX_PAGES_LIMIT);
        }
        List<String> include = cleanPatterns(request.includePatterns(), "includePatterns");
        List<String> exclude = cleanPatterns(request.excludePatterns(), "excludePatterns");
        if (request.credentialId() != null) {
            repository.findCredential(request.credentialId())
                .filter(c -> c.tenantId().equals(tenantId))
                .orElseThrow(() -> new JobValidationException("unknown credential: " + request.credentialId()));
        }
        boolean active = request.active() == null || request.active();
        return new CrawlJob(
            request.id() == null ? 0L : request.id(),
            tenantId,
            name,
            baseUrl.trim(),
            schedule.trim(),
            templateId,
            maxDepth,
            maxPages,
            include,
            exclude,
            request.credentialId(),
            active,
            null,
            null,
            active ? nextRun(schedule) : null,
            null,
            null
        );
    }

    private List<String> cleanPatterns(List<String> patterns, String field) {
        if (patterns == null) {
            return List.of();
        }
        try {
            UrlFilter.validate(patterns);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException(field + ": " + e.getMessage());
        }
        return patterns.stream().map(String::trim).distinct().toList();
    }

    private void register(CrawlJob job) {
        if (job.active()) {
            scheduler.scheduleJob(job);
        } else {
            scheduler.unscheduleJob(job.id());
        }
    }

    private CredentialDescriptor findCredential(String tenantId, long credentialId) {
        return repository.findCredential(credentialId)
            .filter(c -> c.tenantId().equals(tenantId))
            .orElseThrow(() -> new JobNotFoundException("Credential " + credentialId + " not found"));
    }

    private Instant nextRun(String schedule) {
        return CronSchedules.nextRun(schedule, ZoneId.of(properties.getScheduler().getZone()), clock.instant());
    }

    private String requireTenant(String tenantId) {
        return requireText(tenantId, "tenantId");
    }

    private String requireText(String value, String field) {
        String trimmed = StringUtils.trimToNull(value);
        if (trimmed == null) {
            throw new JobValidationException(field + " is required");
        }
        return trimmed;
    }
}
