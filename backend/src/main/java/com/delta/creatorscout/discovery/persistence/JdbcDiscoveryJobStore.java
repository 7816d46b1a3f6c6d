package com.delta.creatorscout.discovery.persistence;

import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.model.JobProgressUpdate;
import com.delta.creatorscout.discovery.model.JobStatus;
import com.delta.creatorscout.discovery.model.NewDiscoveryJob;
import com.delta.creatorscout.discovery.model.Platform;
import com.delta.creatorscout.discovery.model.SearchMode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcDiscoveryJobStore implements DiscoveryJobStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcDiscoveryJobStore.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<DiscoveryJob> jobMapper = this::mapJob;

    public JdbcDiscoveryJobStore(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public DiscoveryJob insert(NewDiscoveryJob job, Instant now) {
        UUID id = UUID.randomUUID();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("accountId", job.accountId())
            .addValue("platform", job.platform().name())
            .addValue("mode", job.mode().name())
            .addValue("keywords", writeKeywords(job.keywords()))
            .addValue("seedHandle", job.seedHandle())
            .addValue("region", job.region())
            .addValue("target", job.targetResultCount())
            .addValue("maxApiCalls", job.maxApiCalls())
            .addValue("status", JobStatus.PENDING.name())
            .addValue("now", Timestamp.from(now))
            .addValue("timeoutAt", toTimestamp(job.timeoutAt()));
        jdbc.update(
            """
                INSERT INTO discovery_jobs (
                    id, account_id, platform, search_mode, keywords, seed_handle, region,
                    target_result_count, max_api_calls, status, created_at, updated_at, timeout_at
                )
                VALUES (
                    :id, :accountId, :platform, :mode, :keywords, :seedHandle, :region,
                    :target, :maxApiCalls, :status, :now, :now, :timeoutAt
                )
                """,
            params
        );
        return findById(id).orElseThrow(() -> new IllegalStateException("Inserted job " + id + " not readable"));
    }

    @Override
    public Optional<DiscoveryJob> findById(UUID jobId) {
        List<DiscoveryJob> jobs = jdbc.query(
            """
                SELECT *
                FROM discovery_jobs
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", jobId),
            jobMapper
        );
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    @Override
    public boolean commit(UUID jobId, long expectedVersion, JobProgressUpdate update, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("expectedVersion", expectedVersion)
            .addValue("status", update.status().name())
            .addValue("apiCallsMade", update.apiCallsMade())
            .addValue("results", update.uniqueResultsCollected())
            .addValue("cursor", update.resumeCursor())
            .addValue("exhausted", update.searchExhausted())
            .addValue("progress", update.progressPercent())
            .addValue("failures", update.consecutiveFailures())
            .addValue("error", update.error())
            .addValue("startedAt", toTimestamp(update.startedAt()))
            .addValue("completedAt", toTimestamp(update.completedAt()))
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE discovery_jobs
                SET status = :status,
                    api_calls_made = :apiCallsMade,
                    unique_results_collected = :results,
                    resume_cursor = :cursor,
                    search_exhausted = :exhausted,
                    progress_percent = :progress,
                    consecutive_failures = :failures,
                    error = :error,
                    started_at = :startedAt,
                    completed_at = :completedAt,
                    updated_at = :now,
                    version = version + 1
                WHERE id = :id
                  AND version = :expectedVersion
                """,
            params
        );
        return updated == 1;
    }

    @Override
    public List<DiscoveryJob> findNonTerminal(int limit) {
        return jdbc.query(
            """
                SELECT *
                FROM discovery_jobs
                WHERE status IN ('PENDING', 'PROCESSING')
                ORDER BY created_at ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            jobMapper
        );
    }

    private DiscoveryJob mapJob(ResultSet rs, int rowNum) throws SQLException {
        return new DiscoveryJob(
            rs.getObject("id", UUID.class),
            rs.getString("account_id"),
            Platform.valueOf(rs.getString("platform")),
            SearchMode.valueOf(rs.getString("search_mode")),
            readKeywords(rs.getString("keywords")),
            rs.getString("seed_handle"),
            rs.getString("region"),
            rs.getInt("target_result_count"),
            rs.getInt("max_api_calls"),
            rs.getInt("api_calls_made"),
            rs.getInt("unique_results_collected"),
            rs.getString("resume_cursor"),
            rs.getBoolean("search_exhausted"),
            rs.getInt("progress_percent"),
            JobStatus.valueOf(rs.getString("status")),
            rs.getInt("consecutive_failures"),
            rs.getString("error"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at")),
            toInstant(rs.getTimestamp("updated_at")),
            toInstant(rs.getTimestamp("timeout_at")),
            rs.getLong("version")
        );
    }

    private String writeKeywords(List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(keywords);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize keywords", e);
        }
    }

    private List<String> readKeywords(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable keywords column: {}", json, e);
            return List.of();
        }
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
