package com.delta.pagetracker.crawl.persistence;

import com.delta.pagetracker.crawl.auth.AuthKind;
import com.delta.pagetracker.crawl.model.CrawlError;
import com.delta.pagetracker.crawl.model.CrawlJob;
import com.delta.pagetracker.crawl.model.CredentialDescriptor;
import com.delta.pagetracker.crawl.model.JobRun;
import com.delta.pagetracker.crawl.model.JobRunTally;
import com.delta.pagetracker.crawl.model.JobStatus;
import com.delta.pagetracker.crawl.model.RunStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CrawlJdbcRepositoryTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private CrawlJdbcRepository repository;

    @Test
    void insertsAndReadsJobWithPatterns() {
        long id = repository.insertJob(job("tenant-a", "Docs"), NOW);

        CrawlJob stored = repository.findJob(id).orElseThrow();
        assertThat(stored.name()).isEqualTo("Docs");
        assertThat(stored.status()).isEqualTo(JobStatus.IDLE);
        assertThat(stored.includePatterns()).containsExactly("/docs/");
        assertThat(stored.excludePatterns()).isEmpty();
        assertThat(stored.maxPages()).isEqualTo(50);
        assertThat(stored.credentialId()).isNull();
        assertThat(stored.createdAt()).isEqualTo(NOW);
        assertThat(repository.findJobs("tenant-a")).extracting(CrawlJob::id).contains(id);
        assertThat(repository.findJobs("tenant-b")).extracting(CrawlJob::id).doesNotContain(id);
    }

    @Test
    void updateAndDeleteAreTenantScoped() {
        long id = repository.insertJob(job("tenant-a", "Docs"), NOW);
        CrawlJob stored = repository.findJob(id).orElseThrow();
        CrawlJob foreign = new CrawlJob(id, "tenant-b", "Hijack", stored.baseUrl(), stored.schedule(), null, 1, 10,
            List.of(), List.of(), null, true, JobStatus.IDLE, null, null, null, null);

        assertFalse(repository.updateJob(foreign, NOW));
        assertFalse(repository.deleteJob("tenant-b", id));
        assertThat(repository.findJob(id).orElseThrow().name()).isEqualTo("Docs");
        assertTrue(repository.deleteJob("tenant-a", id));
        assertThat(repository.findJob(id)).isEmpty();
    }

    @Test
    void onlyOneClaimSucceedsUntilJobFinishes() {
        long id = repository.insertJob(job("tenant-a", "Docs"), NOW);

        assertTrue(repository.tryMarkJobRunning(id, NOW));
        assertFalse(repository.tryMarkJobRunning(id, NOW));

        Instant next = NOW.plus(1, ChronoUnit.DAYS);
        repository.finishJob(id, JobStatus.COMPLETED, NOW, next);
        CrawlJob finished = repository.findJob(id).orElseThrow();
        assertThat(finished.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(finished.lastRun()).isEqualTo(NOW);
        assertThat(finished.nextRun()).isEqualTo(next);
        assertTrue(repository.tryMarkJobRunning(id, NOW));
    }

    @Test
    void runReachesExactlyOneTerminalState() {
        long jobId = repository.insertJob(job("tenant-a", "Docs"), NOW);
        long runId = repository.insertRun(jobId, "tenant-a", NOW);
        List<CrawlError> logs = List.of(CrawlError.of("https://example.com/x", "HTTP 404"));

        assertTrue(repository.completeRun(runId, new JobRunTally(3, 2, 1, 2, 0, 2), logs, NOW.plusSeconds(30)));
        assertFalse(repository.failRun(runId, "late failure", List.of(), NOW.plusSeconds(60)));

        JobRun run = repository.findRun(runId).orElseThrow();
        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.urlsProcessed()).isEqualTo(3);
        assertThat(run.urlsSuccessful()).isEqualTo(2);
        assertThat(run.urlsFailed()).isEqualTo(1);
        assertThat(run.documentsCreated()).isEqualTo(2);
        assertThat(run.changesDetected()).isEqualTo(2);
        assertThat(run.errorMessage()).isNull();
        assertThat(run.logs()).containsExactlyElementsOf(logs);
        assertThat(run.completedAt()).isEqualTo(NOW.plusSeconds(30));
    }

    @Test
    void findsRunningRunsAndListsRunsNewestFirst() {
        long jobId = repository.insertJob(job("tenant-a", "Docs"), NOW);
        long oldRun = repository.insertRun(jobId, "tenant-a", NOW.minus(5, ChronoUnit.HOURS));
        long freshRun = repository.insertRun(jobId, "tenant-a", NOW);
        repository.failRun(oldRun, "HTTP 500", List.of(), NOW.minus(4, ChronoUnit.HOURS));

        List<JobRun> running = repository.findRunningRuns();

        assertThat(running).extracting(JobRun::id).contains(freshRun).doesNotContain(oldRun);
        assertThat(repository.findRunsForJob(jobId, 10)).extracting(JobRun::id).containsExactly(freshRun, oldRun);
        assertThat(repository.findRunsForJob(jobId, 1)).hasSize(1);
    }

    @Test
    void credentialUpdateWithoutPayloadKeepsCiphertext() {
        long id = repository.insertCredential("tenant-a", "Wiki", "wiki.company.com", AuthKind.COOKIE, "cipher-1", true, NOW);

        assertTrue(repository.updateCredential(id, "tenant-a", "Wiki SSO", "wiki.company.com", AuthKind.COOKIE, null, false, NOW));

        CredentialDescriptor stored = repository.findCredential(id).orElseThrow();
        assertThat(stored.name()).isEqualTo("Wiki SSO");
        assertThat(stored.encryptedPayload()).isEqualTo("cipher-1");
        assertThat(stored.active()).isFalse();
        assertFalse(repository.deleteCredential("tenant-b", id));
        assertThat(repository.findCredentials("tenant-a")).extracting(CredentialDescriptor::id).contains(id);
    }

    private static CrawlJob job(String tenantId, String name) {
        return new CrawlJob(0L, tenantId, name, "https://docs.example.com/", "0 9 * * 1", null, 2, 50,
            List.of("/docs/"), List.of(), null, true, JobStatus.IDLE, null, null, null, null);
    }
}
