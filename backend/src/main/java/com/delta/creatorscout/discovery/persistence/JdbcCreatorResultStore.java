package com.delta.creatorscout.discovery.persistence;

import com.delta.creatorscout.discovery.model.CreatorRecord;
import com.delta.creatorscout.discovery.model.EnrichmentStatus;
import com.delta.creatorscout.discovery.model.SourceContent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public class JdbcCreatorResultStore implements CreatorResultStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcCreatorResultStore.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcCreatorResultStore(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper, Clock clock) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public List<CreatorRecord> findByJob(UUID jobId) {
        return jdbc.query(
            """
                SELECT *
                FROM job_creators
                WHERE job_id = :jobId
                ORDER BY admission_order ASC
                """,
            new MapSqlParameterSource().addValue("jobId", jobId),
            this::mapRecord
        );
    }

    @Override
    public void saveAll(UUID jobId, Collection<CreatorRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        Timestamp now = Timestamp.from(clock.instant());
        for (CreatorRecord record : records) {
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("platformUserId", record.platformUserId())
                .addValue("handle", record.handle())
                .addValue("displayName", record.displayName())
                .addValue("verified", record.verified())
                .addValue("privateAccount", record.privateAccount())
                .addValue("followers", record.followerCount())
                .addValue("business", record.businessAccount())
                .addValue("score", record.qualityScore())
                .addValue("engagement", record.engagementRate())
                .addValue("biography", record.biography())
                .addValue("emails", writeJson(record.emails()))
                .addValue("enrichmentStatus", record.enrichmentStatus().name())
                .addValue("admissionOrder", record.admissionOrder())
                .addValue("source", writeJson(record.source()))
                .addValue("now", now);
            int updated = jdbc.update(
                """
                    UPDATE job_creators
                    SET handle = :handle,
                        display_name = :displayName,
                        verified = :verified,
                        private_account = :privateAccount,
                        follower_count = :followers,
                        business_account = :business,
                        quality_score = :score,
                        engagement_rate = :engagement,
                        biography = :biography,
                        emails = :emails,
                        enrichment_status = :enrichmentStatus,
                        source_content = :source,
                        updated_at = :now
                    WHERE job_id = :jobId
                      AND platform_user_id = :platformUserId
                    """,
                params
            );
            if (updated == 0) {
                jdbc.update(
                    """
                        INSERT INTO job_creators (
                            job_id, platform_user_id, handle, display_name, verified, private_account,
                            follower_count, business_account, quality_score, engagement_rate, biography,
                            emails, enrichment_status, admission_order, source_content, created_at, updated_at
                        )
                        VALUES (
                            :jobId, :platformUserId, :handle, :displayName, :verified, :privateAccount,
                            :followers, :business, :score, :engagement, :biography,
                            :emails, :enrichmentStatus, :admissionOrder, :source, :now, :now
                        )
                        """,
                    params
                );
            }
        }
    }

    @Override
    public int deleteUndelivered(UUID jobId) {
        return jdbc.update(
            """
                DELETE FROM job_creators
                WHERE job_id = :jobId
                  AND enrichment_status IN ('PENDING', 'REJECTED')
                """,
            new MapSqlParameterSource().addValue("jobId", jobId)
        );
    }

    @Override
    public int countCounted(UUID jobId) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM job_creators
                WHERE job_id = :jobId
                  AND enrichment_status IN ('COMPLETED', 'SKIPPED')
                """,
            new MapSqlParameterSource().addValue("jobId", jobId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    @Override
    public int trimToFirst(UUID jobId, int keep) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("offset", Math.max(0, keep - 1));
        if (keep <= 0) {
            return jdbc.update("DELETE FROM job_creators WHERE job_id = :jobId", params);
        }
        List<Long> cutoff = jdbc.query(
            """
                SELECT admission_order
                FROM job_creators
                WHERE job_id = :jobId
                ORDER BY admission_order ASC
                LIMIT 1 OFFSET :offset
                """,
            params,
            (rs, rowNum) -> rs.getLong("admission_order")
        );
        if (cutoff.isEmpty()) {
            return 0;
        }
        params.addValue("cutoff", cutoff.get(0));
        return jdbc.update(
            """
                DELETE FROM job_creators
                WHERE job_id = :jobId
                  AND admission_order > :cutoff
                """,
            params
        );
    }

    private CreatorRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        return new CreatorRecord(
            rs.getString("platform_user_id"),
            rs.getString("handle"),
            rs.getString("display_name"),
            rs.getBoolean("verified"),
            rs.getBoolean("private_account"),
            rs.getLong("follower_count"),
            rs.getBoolean("business_account"),
            rs.getDouble("quality_score"),
            rs.getDouble("engagement_rate"),
            rs.getString("biography"),
            readEmails(rs.getString("emails")),
            EnrichmentStatus.valueOf(rs.getString("enrichment_status")),
            rs.getLong("admission_order"),
            readSource(rs.getString("source_content"))
        );
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize creator column", e);
        }
    }

    private List<String> readEmails(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable emails column: {}", json, e);
            return List.of();
        }
    }

    private SourceContent readSource(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, SourceContent.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable source_content column", e);
            return null;
        }
    }
}
