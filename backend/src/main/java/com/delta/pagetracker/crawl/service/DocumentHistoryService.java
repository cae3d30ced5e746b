package com.delta.pagetracker.crawl.service;

import com.delta.pagetracker.crawl.change.DocumentVersioner;
import com.delta.pagetracker.crawl.model.ChangeRecord;
import com.delta.pagetracker.crawl.model.VersionedDocument;
import com.delta.pagetracker.crawl.persistence.CrawlJdbcRepository;
import com.delta.pagetracker.crawl.persistence.DocumentJdbcRepository;
import com.delta.pagetracker.crawl.traversal.UrlNormalizer;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DocumentHistoryService {
    private final DocumentJdbcRepository documents;
    private final CrawlJdbcRepository crawlRepository;
    private final DocumentVersioner versioner;

    public DocumentHistoryService(
        DocumentJdbcRepository documents,
        CrawlJdbcRepository crawlRepository,
        DocumentVersioner versioner
    ) {
        this.documents = documents;
        this.crawlRepository = crawlRepository;
        this.versioner = versioner;
    }

    public List<VersionedDocument> versions(String tenantId, String url) {
        if (url == null || url.isBlank()) {
            throw new JobValidationException("url is required");
        }
        String normalized = UrlNormalizer.normalize(url);
        return documents.findVersions(tenantId, normalized == null ? url.trim() : normalized);
    }

    public VersionedDocument document(String tenantId, long documentId) {
        return documents.findDocument(documentId)
            .filter(d -> d.tenantId().equals(tenantId))
            .orElseThrow(() -> new JobNotFoundException("Document " + documentId + " not found"));
    }

    public List<ChangeRecord> changes(String tenantId, long documentId) {
        VersionedDocument document = document(tenantId, documentId);
        return documents.findChangesForUrl(tenantId, document.url());
    }

    public List<ChangeRecord> changesForRun(String tenantId, long runId) {
        crawlRepository.findRun(runId)
            .filter(run -> run.tenantId().equals(tenantId))
            .orElseThrow(() -> new JobNotFoundException("Job run " + runId + " not found"));
        return documents.findChangesForRun(runId);
    }

    public int backfillEmbeddings(int limit) {
        return versioner.backfillEmbeddings(Math.max(1, Math.min(limit, 1000)));
    }
}
