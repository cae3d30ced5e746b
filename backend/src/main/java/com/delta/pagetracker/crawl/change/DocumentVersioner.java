package com.delta.pagetracker.crawl.change;

import com.delta.pagetracker.crawl.embedding.EmbeddingClient;
import com.delta.pagetracker.crawl.model.ChangeType;
import com.delta.pagetracker.crawl.model.ScrapedPage;
import com.delta.pagetracker.crawl.model.VersionedDocument;
import com.delta.pagetracker.crawl.persistence.DocumentJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maintains one version chain per (tenant, url). A chain gains a version only when the page is new
 * or its content moved past the significance threshold; re-fetching unchanged content is a no-op.
 */
@Service
public class DocumentVersioner {
    private static final Logger log = LoggerFactory.getLogger(DocumentVersioner.class);
    static final String CREATED_SUMMARY = "New document created";

    private final DocumentJdbcRepository documents;
    private final ChangeDetector changeDetector;
    private final EmbeddingClient embeddingClient;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Autowired
    public DocumentVersioner(
        DocumentJdbcRepository documents,
        ChangeDetector changeDetector,
        EmbeddingClient embeddingClient,
        PlatformTransactionManager transactionManager
    ) {
        this(documents, changeDetector, embeddingClient, new TransactionTemplate(transactionManager), Clock.systemUTC());
    }

    DocumentVersioner(
        DocumentJdbcRepository documents,
        ChangeDetector changeDetector,
        EmbeddingClient embeddingClient,
        TransactionTemplate transactionTemplate,
        Clock clock
    ) {
        this.documents = documents;
        this.changeDetector = changeDetector;
        this.embeddingClient = embeddingClient;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public VersioningOutcome applyVersioning(String tenantId, Long jobId, Long jobRunId, ScrapedPage page) {
        VersioningOutcome outcome = transactionTemplate.execute(status -> writeVersion(tenantId, jobId, jobRunId, page));
        if (outcome == null) {
            throw new IllegalStateException("Versioning transaction returned no outcome for " + page.url());
        }
        if (outcome.recordedChange()) {
            embedQuietly(outcome.documentId(), page.content());
        }
        return outcome;
    }

    public int backfillEmbeddings(int limit) {
        if (!embeddingClient.isEnabled()) {
            log.info("Embedding backfill skipped; no embedding endpoint configured");
            return 0;
        }
        List<VersionedDocument> pending = documents.findActiveDocumentsWithoutEmbedding(limit);
        int embedded = 0;
        for (VersionedDocument document : pending) {
            if (embedQuietly(document.id(), document.content())) {
                embedded++;
            }
        }
        log.info("Embedding backfill embedded={} candidates={}", embedded, pending.size());
        return embedded;
    }

    private VersioningOutcome writeVersion(String tenantId, Long jobId, Long jobRunId, ScrapedPage page) {
        Instant now = clock.instant();
        Optional<VersionedDocument> existing = documents.findActiveDocument(tenantId, page.url());
        if (existing.isEmpty()) {
            long id = documents.insertDocument(tenantId, jobId, page, 1, now);
            documents.insertChange(
                tenantId, id, jobRunId, ChangeType.CREATED, null, page.contentHash(), null, CREATED_SUMMARY, now);
            log.debug("Created document id={} url={}", id, page.url());
            return new VersioningOutcome(VersioningOutcome.Action.CREATED, id, 1, null);
        }

        VersionedDocument prior = existing.get();
        if (Objects.equals(prior.contentHash(), page.contentHash())) {
            return new VersioningOutcome(VersioningOutcome.Action.UNCHANGED, prior.id(), prior.version(), 0.0);
        }
        ChangeAssessment assessment = changeDetector.detectChange(prior.content(), page.content());
        if (!assessment.significant()) {
            log.debug("Change below threshold url={} pct={}", page.url(), assessment.changePercentage());
            return new VersioningOutcome(
                VersioningOutcome.Action.UNCHANGED, prior.id(), prior.version(), assessment.changePercentage());
        }

        int nextVersion = prior.version() + 1;
        documents.deactivateDocument(prior.id(), now);
        long id = documents.insertDocument(tenantId, jobId, page, nextVersion, now);
        documents.insertChange(
            tenantId,
            id,
            jobRunId,
            ChangeType.UPDATED,
            prior.contentHash(),
            page.contentHash(),
            assessment.changePercentage(),
            assessment.summary(),
            now
        );
        log.debug("Versioned document url={} version={} pct={}", page.url(), nextVersion, assessment.changePercentage());
        return new VersioningOutcome(VersioningOutcome.Action.UPDATED, id, nextVersion, assessment.changePercentage());
    }

    private boolean embedQuietly(Long documentId, String content) {
        if (documentId == null || !embeddingClient.isEnabled()) {
            return false;
        }
        try {
            float[] vector = embeddingClient.embed(content);
            if (vector == null || vector.length == 0) {
                return false;
            }
            documents.updateEmbedding(documentId, vector);
            return true;
        } catch (RuntimeException e) {
            log.warn("Embedding failed for document {}; version kept without vector: {}", documentId, e.getMessage());
            return false;
        }
    }
}
