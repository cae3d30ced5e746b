package com.delta.pagetracker.crawl.api;

import com.delta.pagetracker.crawl.model.ChangeRecord;
import com.delta.pagetracker.crawl.model.CrawlJob;
import com.delta.pagetracker.crawl.model.CrawlJobRequest;
import com.delta.pagetracker.crawl.model.CredentialRequest;
import com.delta.pagetracker.crawl.model.CredentialView;
import com.delta.pagetracker.crawl.model.JobRun;
import com.delta.pagetracker.crawl.model.SchedulerStatus;
import com.delta.pagetracker.crawl.model.VersionedDocument;
import com.delta.pagetracker.crawl.service.CrawlJobService;
import com.delta.pagetracker.crawl.service.CrawlSchedulerService;
import com.delta.pagetracker.crawl.service.DocumentHistoryService;
import com.delta.pagetracker.crawl.service.JobNotFoundException;
import com.delta.pagetracker.crawl.service.JobValidationException;
import com.delta.pagetracker.crawl.template.TemplateCatalog;
import com.delta.pagetracker.crawl.template.TemplateCategory;
import com.delta.pagetracker.crawl.template.WebsiteTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class CrawlController {
    static final String TENANT_HEADER = "X-Tenant-Id";

    private final TemplateCatalog templateCatalog;
    private final CrawlJobService jobService;
    private final CrawlSchedulerService schedulerService;
    private final DocumentHistoryService documentHistoryService;

    public CrawlController(
        TemplateCatalog templateCatalog,
        CrawlJobService jobService,
        CrawlSchedulerService schedulerService,
        DocumentHistoryService documentHistoryService
    ) {
        this.templateCatalog = templateCatalog;
        this.jobService = jobService;
        this.schedulerService = schedulerService;
        this.documentHistoryService = documentHistoryService;
    }

    // ---- templates ----

    @GetMapping("/templates")
    public List<WebsiteTemplate> templates(@RequestParam(name = "category", required = false) String category) {
        if (category == null || category.isBlank()) {
            return templateCatalog.listTemplates();
        }
        TemplateCategory parsed;
        try {
            parsed = TemplateCategory.fromValue(category);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("unknown template category: " + category);
        }
        return templateCatalog.getTemplatesByCategory(parsed);
    }

    @GetMapping("/templates/suggest")
    public WebsiteTemplate suggestTemplate(@RequestParam("url") String url) {
        return templateCatalog.suggestTemplateForUrl(url);
    }

    @GetMapping("/templates/{id}")
    public WebsiteTemplate template(@PathVariable("id") String id) {
        return templateCatalog.getTemplateById(id)
            .orElseThrow(() -> new JobNotFoundException("Template " + id + " not found"));
    }

    @PostMapping("/templates/custom")
    public WebsiteTemplate customTemplate(@RequestBody CustomTemplateRequest request) {
        return templateCatalog.createCustomTemplate(
            request.name(),
            request.maxDepth() == null ? 2 : request.maxDepth(),
            request.maxPages() == null ? 50 : request.maxPages(),
            request.includePatterns(),
            request.excludePatterns()
        );
    }

    // ---- credentials ----

    @GetMapping("/credentials")
    public List<CredentialView> credentials(@RequestHeader(TENANT_HEADER) String tenantId) {
        return jobService.listCredentials(tenantId);
    }

    @PostMapping("/credentials")
    public ResponseEntity<CredentialView> createCredential(
        @RequestHeader(TENANT_HEADER) String tenantId,
        @RequestBody CredentialRequest request
    ) {
        CredentialView saved = jobService.saveCredential(withTenant(request, null, tenantId));
        return ResponseEntity.status(HttpStatus.CREATED).body(saved);
    }

    @PutMapping("/credentials/{id}")
    public CredentialView updateCredential(
        @RequestHeader(TENANT_HEADER) String tenantId,
        @PathVariable("id") long id,
        @RequestBody CredentialRequest request
    ) {
        return jobService.saveCredential(withTenant(request, id, tenantId));
    }

    @DeleteMapping("/credentials/{id}")
    public ResponseEntity<Void> deleteCredential(
        @RequestHeader(TENANT_HEADER) String tenantId,
        @PathVariable("id") long id
    ) {
        jobService.deleteCredential(tenantId, id);
        return ResponseEntity.noContent().build();
    }

    // ---- jobs ----

    @GetMapping("/jobs")
    public List<CrawlJob> jobs(@RequestHeader(TENANT_HEADER) String tenantId) {
        return jobService.listJobs(tenantId);
    }

    @GetMapping("/jobs/{id}")
    public CrawlJob job(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable("id") long id) {
        return jobService.getJob(tenantId, id);
    }

    @PostMapping("/jobs")
    public ResponseEntity<CrawlJob> createJob(
        @RequestHeader(TENANT_HEADER) String tenantId,
        @RequestBody CrawlJobRequest request
    ) {
        CrawlJob saved = jobService.saveJob(withTenant(request, null, tenantId));
        return ResponseEntity.status(HttpStatus.CREATED).body(saved);
    }

    @PutMapping("/jobs/{id}")
    public CrawlJob updateJob(
        @RequestHeader(TENANT_HEADER) String tenantId,
        @PathVariable("id") long id,
        @RequestBody CrawlJobRequest request
    ) {
        return jobService.saveJob(withTenant(request, id, tenantId));
    }

    @PostMapping("/jobs/{id}/active")
    public CrawlJob setActive(
        @RequestHeader(TENANT_HEADER) String tenantId,
        @PathVariable("id") long id,
        @RequestParam("value") boolean active
    ) {
        return jobService.setActive(tenantId, id, active);
    }

    @DeleteMapping("/jobs/{id}")
    public ResponseEntity<Void> deleteJob(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable("id") long id) {
        jobService.deleteJob(tenantId, id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/jobs/{id}/run")
    public ResponseEntity<JobRun> runJob(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable("id") long id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(jobService.runNow(tenantId, id));
    }

    @PostMapping("/jobs/{id}/cancel")
    public Map<String, Object> cancelJob(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable("id") long id) {
        return Map.of("jobId", id, "cancelled", jobService.cancelRun(tenantId, id));
    }

    @GetMapping("/jobs/{id}/runs")
    public List<JobRun> runs(
        @RequestHeader(TENANT_HEADER) String tenantId,
        @PathVariable("id") long id,
        @RequestParam(name = "limit", required = false, defaultValue = "20") int limit
    ) {
        return jobService.listRuns(tenantId, id, limit);
    }

    @GetMapping("/runs/{id}")
    public JobRun run(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable("id") long id) {
        return jobService.getRun(tenantId, id);
    }

    @GetMapping("/runs/{id}/changes")
    public List<ChangeRecord> runChanges(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable("id") long id) {
        return documentHistoryService.changesForRun(tenantId, id);
    }

    // ---- documents ----

    @GetMapping("/documents/versions")
    public List<VersionedDocument> versions(
        @RequestHeader(TENANT_HEADER) String tenantId,
        @RequestParam("url") String url
    ) {
        return documentHistoryService.versions(tenantId, url);
    }

    @GetMapping("/documents/{id}")
    public VersionedDocument document(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable("id") long id) {
        return documentHistoryService.document(tenantId, id);
    }

    @GetMapping("/documents/{id}/changes")
    public List<ChangeRecord> changes(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable("id") long id) {
        return documentHistoryService.changes(tenantId, id);
    }

    @PostMapping("/documents/embeddings/backfill")
    public Map<String, Object> backfillEmbeddings(
        @RequestParam(name = "limit", required = false, defaultValue = "100") int limit
    ) {
        return Map.of("embedded", documentHistoryService.backfillEmbeddings(limit));
    }

    // ---- scheduler ----

    @GetMapping("/scheduler/status")
    public SchedulerStatus schedulerStatus() {
        return schedulerService.getStatus();
    }

    @PostMapping("/scheduler/reload")
    public SchedulerStatus reloadScheduler() {
        schedulerService.reloadJobs();
        return schedulerService.getStatus();
    }

    private CrawlJobRequest withTenant(CrawlJobRequest request, Long id, String tenantId) {
        if (request == null) {
            throw new JobValidationException("job is required");
        }
        return new CrawlJobRequest(
            id,
            tenantId,
            request.name(),
            request.baseUrl(),
            request.schedule(),
            request.templateId(),
            request.maxDepth(),
            request.maxPages(),
            request.includePatterns(),
            request.excludePatterns(),
            request.credentialId(),
            request.active()
        );
    }

    private CredentialRequest withTenant(CredentialRequest request, Long id, String tenantId) {
        if (request == null) {
            throw new JobValidationException("credential is required");
        }
        return new CredentialRequest(
            id,
            tenantId,
            request.name(),
            request.domain(),
            request.authKind(),
            request.payload(),
            request.active()
        );
    }
}
