package com.delta.pagetracker.crawl.persistence;

import com.delta.pagetracker.crawl.model.ChangeRecord;
import com.delta.pagetracker.crawl.model.ChangeType;
import com.delta.pagetracker.crawl.model.PageMetadata;
import com.delta.pagetracker.crawl.model.ScrapedPage;
import com.delta.pagetracker.crawl.model.VersionedDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
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
public class DocumentJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(DocumentJdbcRepository.class);
    private static final int MAX_TITLE = 1024;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public DocumentJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public Optional<VersionedDocument> findActiveDocument(String tenantId, String url) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("url", url);
        List<VersionedDocument> rows = jdbc.query(
            DOCUMENT_SELECT + """
                WHERE tenant_id = :tenantId
                  AND url = :url
                  AND is_active = TRUE
                ORDER BY version DESC
                """,
            params,
            documentRowMapper()
        );
        return rows.stream().findFirst();
    }

    public Optional<VersionedDocument> findDocument(long id) {
        List<VersionedDocument> rows = jdbc.query(
            DOCUMENT_SELECT + " WHERE id = :id",
            new MapSqlParameterSource("id", id),
            documentRowMapper()
        );
        return rows.stream().findFirst();
    }

    public List<VersionedDocument> findVersions(String tenantId, String url) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("url", url);
        return jdbc.query(
            DOCUMENT_SELECT + " WHERE tenant_id = :tenantId AND url = :url ORDER BY version DESC",
            params,
            documentRowMapper()
        );
    }

    public List<VersionedDocument> findActiveDocumentsWithoutEmbedding(int limit) {
        return jdbc.query(
            DOCUMENT_SELECT + " WHERE is_active = TRUE AND embedding IS NULL ORDER BY id LIMIT :limit",
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            documentRowMapper()
        );
    }

    public int countActiveDocuments(String tenantId, String url) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("url", url);
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM versioned_documents
                WHERE tenant_id = :tenantId
                  AND url = :url
                  AND is_active = TRUE
                """,
            params,
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public long insertDocument(String tenantId, Long jobId, ScrapedPage page, int version, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("jobId", jobId)
            .addValue("url", page.url())
            .addValue("parentUrl", page.metadata() == null ? null : page.metadata().parentUrl())
            .addValue("title", truncate(page.title(), MAX_TITLE))
            .addValue("content", page.content())
            .addValue("contentHash", page.contentHash())
            .addValue("metadata", writeJson(page.metadata()))
            .addValue("version", version)
            .addValue("depth", page.depth())
            .addValue("now", toTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO versioned_documents (
                    tenant_id, job_id, url, parent_url, title, content, content_hash, metadata,
                    version, depth, is_active, created_at, updated_at
                )
                VALUES (
                    :tenantId, :jobId, :url, :parentUrl, :title, :content, :contentHash, :metadata,
                    :version, :depth, TRUE, :now, :now
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public boolean deactivateDocument(long id, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE versioned_documents
                SET is_active = FALSE,
                    updated_at = :now
                WHERE id = :id
                  AND is_active = TRUE
                """,
            params
        );
        return updated > 0;
    }

    public void updateEmbedding(long id, float[] embedding) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("embedding", writeJson(embedding));
        jdbc.update("UPDATE versioned_documents SET embedding = :embedding WHERE id = :id", params);
    }

    public long insertChange(
        String tenantId,
        long documentId,
        Long jobRunId,
        ChangeType changeType,
        String oldContentHash,
        String newContentHash,
        Double changePercentage,
        String summary,
        Instant detectedAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("documentId", documentId)
            .addValue("jobRunId", jobRunId)
            .addValue("changeType", changeType.value())
            .addValue("oldHash", oldContentHash)
            .addValue("newHash", newContentHash)
            .addValue("changePercentage", changePercentage)
            .addValue("summary", summary)
            .addValue("detectedAt", toTimestamp(detectedAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO change_records (
                    tenant_id, document_id, job_run_id, change_type, old_content_hash,
                    new_content_hash, change_percentage, summary, detected_at
                )
                VALUES (
                    :tenantId, :documentId, :jobRunId, :changeType, :oldHash,
                    :newHash, :changePercentage, :summary, :detectedAt
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public List<ChangeRecord> findChanges(long documentId) {
        return jdbc.query(
            CHANGE_SELECT + " WHERE document_id = :documentId ORDER BY detected_at, id",
            new MapSqlParameterSource("documentId", documentId),
            changeRowMapper()
        );
    }

    public List<ChangeRecord> findChangesForUrl(String tenantId, String url) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("url", url);
        return jdbc.query(
            """
                SELECT c.id, c.tenant_id, c.document_id, c.job_run_id, c.change_type, c.old_content_hash,
                       c.new_content_hash, c.change_percentage, c.summary, c.detected_at
                FROM change_records c
                JOIN versioned_documents d ON d.id = c.document_id
                WHERE d.tenant_id = :tenantId
                  AND d.url = :url
                ORDER BY d.version, c.id
                """,
            params,
            changeRowMapper()
        );
    }

    public List<ChangeRecord> findChangesForRun(long jobRunId) {
        return jdbc.query(
            CHANGE_SELECT + " WHERE job_run_id = :jobRunId ORDER BY id",
            new MapSqlParameterSource("jobRunId", jobRunId),
            changeRowMapper()
        );
    }

    private static final String DOCUMENT_SELECT = """
        SELECT id, tenant_id, job_id, url, parent_url, title, content, content_hash, metadata,
               embedding, version, depth, is_active, created_at, updated_at
        FROM versioned_documents
        """;

    private static final String CHANGE_SELECT = """
        SELECT id, tenant_id, document_id, job_run_id, change_type, old_content_hash,
               new_content_hash, change_percentage, summary, detected_at
        FROM change_records
        """;

    private RowMapper<VersionedDocument> documentRowMapper() {
        return (rs, rowNum) -> new VersionedDocument(
            rs.getLong("id"),
            rs.getString("tenant_id"),
            rs.getObject("job_id") == null ? null : rs.getLong("job_id"),
            rs.getString("url"),
            rs.getString("parent_url"),
            rs.getString("title"),
            rs.getString("content"),
            rs.getString("content_hash"),
            readMetadata(rs.getString("metadata")),
            rs.getInt("version"),
            rs.getInt("depth"),
            rs.getBoolean("is_active"),
            rs.getString("embedding") != null,
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private RowMapper<ChangeRecord> changeRowMapper() {
        return (rs, rowNum) -> new ChangeRecord(
            rs.getLong("id"),
            rs.getString("tenant_id"),
            rs.getLong("document_id"),
            rs.getObject("job_run_id") == null ? null : rs.getLong("job_run_id"),
            ChangeType.fromValue(rs.getString("change_type")),
            rs.getString("old_content_hash"),
            rs.getString("new_content_hash"),
            rs.getObject("change_percentage") == null ? null : rs.getDouble("change_percentage"),
            rs.getString("summary"),
            toInstant(rs.getTimestamp("detected_at"))
        );
    }

    private PageMetadata readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, PageMetadata.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable document metadata; ignoring", e);
            return null;
        }
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize JSON column", e);
        }
    }

    private String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
