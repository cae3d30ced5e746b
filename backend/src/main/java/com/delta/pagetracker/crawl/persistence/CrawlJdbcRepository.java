package com.delta.pagetracker.crawl.persistence;

import com.delta.pagetracker.crawl.auth.AuthKind;
import com.delta.pagetracker.crawl.model.CrawlError;
import com.delta.pagetracker.crawl.model.CrawlJob;
import com.delta.pagetracker.crawl.model.CredentialDescriptor;
import com.delta.pagetracker.crawl.model.JobRun;
import com.delta.pagetracker.crawl.model.JobRunTally;
import com.delta.pagetracker.crawl.model.JobStatus;
import com.delta.pagetracker.crawl.model.RunStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class CrawlJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(CrawlJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<CrawlError>> ERROR_LIST = new TypeReference<>() {};
    private static final int MAX_ERROR_MESSAGE = 4000;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public CrawlJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    // ---- jobs ----

    public long insertJob(CrawlJob job, Instant now) {
        MapSqlParameterSource params = jobParams(job)
            .addValue("status", JobStatus.IDLE.value())
            .addValue("createdAt", toTimestamp(now))
            .addValue("updatedAt", toTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO crawl_jobs (
                    tenant_id, name, base_url, schedule, template_id, max_depth, max_pages,
                    include_patterns, exclude_patterns, credential_id, is_active, status,
                    next_run, created_at, updated_at
                )
                VALUES (
                    :tenantId, :name, :baseUrl, :schedule, :templateId, :maxDepth, :maxPages,
                    :includePatterns, :excludePatterns, :credentialId, :active, :status,
                    :nextRun, :createdAt, :updatedAt
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public boolean updateJob(CrawlJob job, Instant now) {
        MapSqlParameterSource params = jobParams(job)
            .addValue("id", job.id())
            .addValue("updatedAt", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET name = :name,
                    base_url = :baseUrl,
                    schedule = :schedule,
                    template_id = :templateId,
                    max_depth = :maxDepth,
                    max_pages = :maxPages,
                    include_patterns = :includePatterns,
                    exclude_patterns = :excludePatterns,
                    credential_id = :credentialId,
                    is_active = :active,
                    next_run = :nextRun,
                    updated_at = :updatedAt
                WHERE id = :id
                  AND tenant_id = :tenantId
                """,
            params
        );
        return updated > 0;
    }

    public boolean deleteJob(String tenantId, long jobId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("tenantId", tenantId);
        return jdbc.update("DELETE FROM crawl_jobs WHERE id = :id AND tenant_id = :tenantId", params) > 0;
    }

    public Optional<CrawlJob> findJob(long jobId) {
        List<CrawlJob> rows = jdbc.query(
            JOB_SELECT + " WHERE id = :id",
            new MapSqlParameterSource("id", jobId),
            jobRowMapper()
        );
        return rows.stream().findFirst();
    }

    public List<CrawlJob> findJobs(String tenantId) {
        return jdbc.query(
            JOB_SELECT + " WHERE tenant_id = :tenantId ORDER BY id",
            new MapSqlParameterSource("tenantId", tenantId),
            jobRowMapper()
        );
    }

    public List<CrawlJob> findActiveJobs() {
        return jdbc.query(
            JOB_SELECT + " WHERE is_active = TRUE ORDER BY id",
            new MapSqlParameterSource(),
            jobRowMapper()
        );
    }

    /**
     * Atomically moves a job to {@code running}. Returns false when another run already holds it.
     */
    public boolean tryMarkJobRunning(long jobId, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("running", JobStatus.RUNNING.value())
            .addValue("updatedAt", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = :running,
                    updated_at = :updatedAt
                WHERE id = :id
                  AND status <> :running
                """,
            params
        );
        return updated == 1;
    }

    public void finishJob(long jobId, JobStatus status, Instant lastRun, Instant nextRun) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("status", status.value())
            .addValue("lastRun", toTimestamp(lastRun))
            .addValue("nextRun", toTimestamp(nextRun))
            .addValue("updatedAt", toTimestamp(lastRun));
        jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = :status,
                    last_run = :lastRun,
                    next_run = :nextRun,
                    updated_at = :updatedAt
                WHERE id = :id
                """,
            params
        );
    }

    public void updateNextRun(long jobId, Instant nextRun) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("nextRun", toTimestamp(nextRun));
        jdbc.update("UPDATE crawl_jobs SET next_run = :nextRun WHERE id = :id", params);
    }

    // ---- runs ----

    public long insertRun(long jobId, String tenantId, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("tenantId", tenantId)
            .addValue("status", RunStatus.RUNNING.value())
            .addValue("startedAt", toTimestamp(startedAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO job_runs (job_id, tenant_id, status, started_at)
                VALUES (:jobId, :tenantId, :status, :startedAt)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public boolean completeRun(long runId, JobRunTally tally, List<CrawlError> logs, Instant completedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", runId)
            .addValue("status", RunStatus.COMPLETED.value())
            .addValue("running", RunStatus.RUNNING.value())
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("urlsProcessed", tally.urlsProcessed())
            .addValue("urlsSuccessful", tally.urlsSuccessful())
            .addValue("urlsFailed", tally.urlsFailed())
            .addValue("documentsCreated", tally.documentsCreated())
            .addValue("documentsUpdated", tally.documentsUpdated())
            .addValue("changesDetected", tally.changesDetected())
            .addValue("logs", writeJson(logs == null ? List.of() : logs));
        int updated = jdbc.update(
            """
                UPDATE job_runs
                SET status = :status,
                    completed_at = :completedAt,
                    urls_processed = :urlsProcessed,
                    urls_successful = :urlsSuccessful,
                    urls_failed = :urlsFailed,
                    documents_created = :documentsCreated,
                    documents_updated = :documentsUpdated,
                    changes_detected = :changesDetected,
                    logs = :logs
                WHERE id = :id
                  AND status = :running
                """,
            params
        );
        if (updated == 0) {
            log.warn("Run {} was not running; completion ignored", runId);
        }
        return updated > 0;
    }

    public boolean failRun(long runId, String errorMessage, List<CrawlError> logs, Instant completedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", runId)
            .addValue("status", RunStatus.FAILED.value())
            .addValue("running", RunStatus.RUNNING.value())
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("errorMessage", truncate(errorMessage))
            .addValue("logs", writeJson(logs == null ? List.of() : logs));
        int updated = jdbc.update(
            """
                UPDATE job_runs
                SET status = :status,
                    completed_at = :completedAt,
                    error_message = :errorMessage,
                    logs = :logs
                WHERE id = :id
                  AND status = :running
                """,
            params
        );
        if (updated == 0) {
            log.warn("Run {} was not running; failure ignored", runId);
        }
        return updated > 0;
    }

    public Optional<JobRun> findRun(long runId) {
        List<JobRun> rows = jdbc.query(
            RUN_SELECT + " WHERE id = :id",
            new MapSqlParameterSource("id", runId),
            runRowMapper()
        );
        return rows.stream().findFirst();
    }

    public List<JobRun> findRunsForJob(long jobId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            RUN_SELECT + " WHERE job_id = :jobId ORDER BY started_at DESC, id DESC LIMIT :limit",
            params,
            runRowMapper()
        );
    }

    public List<JobRun> findRunningRuns() {
        return jdbc.query(
            RUN_SELECT + " WHERE status = :running ORDER BY id",
            new MapSqlParameterSource("running", RunStatus.RUNNING.value()),
            runRowMapper()
        );
    }

    /**
     * Jobs marked {@code running} that have no open run row, e.g. after a crash between the claim
     * and the run insert.
     */
    public List<CrawlJob> findJobsStuckRunning() {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobRunning", JobStatus.RUNNING.value())
            .addValue("runRunning", RunStatus.RUNNING.value());
        return jdbc.query(
            JOB_SELECT + """
                 WHERE status = :jobRunning
                  AND NOT EXISTS (
                      SELECT 1 FROM job_runs r WHERE r.job_id = crawl_jobs.id AND r.status = :runRunning
                  )
                ORDER BY id
                """,
            params,
            jobRowMapper()
        );
    }

    // ---- credentials ----

    public long insertCredential(
        String tenantId,
        String name,
        String domain,
        AuthKind authKind,
        String encryptedPayload,
        boolean active,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("name", name)
            .addValue("domain", domain)
            .addValue("authKind", authKind.value())
            .addValue("payload", encryptedPayload)
            .addValue("active", active)
            .addValue("now", toTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO crawl_credentials (
                    tenant_id, name, domain, auth_kind, encrypted_payload, is_active, created_at, updated_at
                )
                VALUES (
                    :tenantId, :name, :domain, :authKind, :payload, :active, :now, :now
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    // A null payload keeps the stored ciphertext.
    public boolean updateCredential(
        long id,
        String tenantId,
        String name,
        String domain,
        AuthKind authKind,
        String encryptedPayload,
        boolean active,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("tenantId", tenantId)
            .addValue("name", name)
            .addValue("domain", domain)
            .addValue("authKind", authKind.value())
            .addValue("payload", encryptedPayload)
            .addValue("active", active)
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE crawl_credentials
                SET name = :name,
                    domain = :domain,
                    auth_kind = :authKind,
                    encrypted_payload = COALESCE(:payload, encrypted_payload),
                    is_active = :active,
                    updated_at = :now
                WHERE id = :id
                  AND tenant_id = :tenantId
                """,
            params
        );
        return updated > 0;
    }

    public boolean deleteCredential(String tenantId, long id) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("tenantId", tenantId);
        return jdbc.update("DELETE FROM crawl_credentials WHERE id = :id AND tenant_id = :tenantId", params) > 0;
    }

    public Optional<CredentialDescriptor> findCredential(long id) {
        List<CredentialDescriptor> rows = jdbc.query(
            CREDENTIAL_SELECT + " WHERE id = :id",
            new MapSqlParameterSource("id", id),
            credentialRowMapper()
        );
        return rows.stream().findFirst();
    }

    public List<CredentialDescriptor> findCredentials(String tenantId) {
        return jdbc.query(
            CREDENTIAL_SELECT + " WHERE tenant_id = :tenantId ORDER BY id",
            new MapSqlParameterSource("tenantId", tenantId),
            credentialRowMapper()
        );
    }

    // ---- mapping ----

    private static final String JOB_SELECT = """
        SELECT id, tenant_id, name, base_url, schedule, template_id, max_depth, max_pages,
               include_patterns, exclude_patterns, credential_id, is_active, status,
               last_run, next_run, created_at, updated_at
        FROM crawl_jobs
        """;

    private static final String RUN_SELECT = """
        SELECT id, job_id, tenant_id, status, started_at, completed_at, urls_processed,
               urls_successful, urls_failed, documents_created, documents_updated,
               changes_detected, error_message, logs
        FROM job_runs
        """;

    private static final String CREDENTIAL_SELECT = """
        SELECT id, tenant_id, name, domain, auth_kind, encrypted_payload, is_active, created_at, updated_at
        FROM crawl_credentials
        """;

    private MapSqlParameterSource jobParams(CrawlJob job) {
        return new MapSqlParameterSource()
            .addValue("tenantId", job.tenantId())
            .addValue("name", job.name())
            .addValue("baseUrl", job.baseUrl())
            .addValue("schedule", job.schedule())
            .addValue("templateId", job.templateId())
            .addValue("maxDepth", job.maxDepth())
            .addValue("maxPages", job.maxPages())
            .addValue("includePatterns", writeJson(job.includePatterns()))
            .addValue("excludePatterns", writeJson(job.excludePatterns()))
            .addValue("credentialId", job.credentialId())
            .addValue("active", job.active())
            .addValue("nextRun", toTimestamp(job.nextRun()));
    }

    private RowMapper<CrawlJob> jobRowMapper() {
        return (rs, rowNum) -> new CrawlJob(
            rs.getLong("id"),
            rs.getString("tenant_id"),
            rs.getString("name"),
            rs.getString("base_url"),
            rs.getString("schedule"),
            rs.getString("template_id"),
            rs.getInt("max_depth"),
            (Integer) rs.getObject("max_pages"),
            readJson(rs.getString("include_patterns"), STRING_LIST),
            readJson(rs.getString("exclude_patterns"), STRING_LIST),
            rs.getObject("credential_id") == null ? null : rs.getLong("credential_id"),
            rs.getBoolean("is_active"),
            JobStatus.fromValue(rs.getString("status")),
            toInstant(rs.getTimestamp("last_run")),
            toInstant(rs.getTimestamp("next_run")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private RowMapper<JobRun> runRowMapper() {
        return (rs, rowNum) -> new JobRun(
            rs.getLong("id"),
            rs.getLong("job_id"),
            rs.getString("tenant_id"),
            RunStatus.fromValue(rs.getString("status")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at")),
            rs.getInt("urls_processed"),
            rs.getInt("urls_successful"),
            rs.getInt("urls_failed"),
            rs.getInt("documents_created"),
            rs.getInt("documents_updated"),
            rs.getInt("changes_detected"),
            rs.getString("error_message"),
            readJson(rs.getString("logs"), ERROR_LIST)
        );
    }

    private RowMapper<CredentialDescriptor> credentialRowMapper() {
        return (rs, rowNum) -> new CredentialDescriptor(
            rs.getLong("id"),
            rs.getString("tenant_id"),
            rs.getString("name"),
            rs.getString("domain"),
            AuthKind.fromValue(rs.getString("auth_kind")),
            rs.getString("encrypted_payload"),
            rs.getBoolean("is_active"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private <T> List<T> readJson(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable JSON column value; treating as empty", e);
            return List.of();
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize JSON column", e);
        }
    }

    private String truncate(String detail) {
        if (detail == null) {
            return null;
        }
        String trimmed = detail.trim();
        return trimmed.length() <= MAX_ERROR_MESSAGE ? trimmed : trimmed.substring(0, MAX_ERROR_MESSAGE);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
