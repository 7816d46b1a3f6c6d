package com.delta.creatorscout.discovery.persistence;

import com.delta.creatorscout.discovery.model.ContinuationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * One row per job. A job with a pending message is never enqueued twice, so at most one invocation
 * chain exists per job.
 */
@Repository
public class JdbcContinuationQueue implements ContinuationQueue {
    private static final Logger log = LoggerFactory.getLogger(JdbcContinuationQueue.class);
    private static final int MAX_ERROR_LENGTH = 1000;

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;
    private final boolean postgres;
    private final RowMapper<ContinuationMessage> messageMapper = (rs, rowNum) -> new ContinuationMessage(
        rs.getLong("id"),
        rs.getObject("job_id", UUID.class),
        rs.getTimestamp("run_at").toInstant(),
        rs.getInt("delivery_count")
    );

    public JdbcContinuationQueue(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
        this.postgres = detectPostgres(jdbc);
    }

    @Override
    public void enqueue(UUID jobId, Duration delay) {
        Instant now = clock.instant();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("runAt", Timestamp.from(now.plus(nonNegative(delay))))
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE continuation_messages
                SET run_at = LEAST(run_at, :runAt),
                    updated_at = :now
                WHERE job_id = :jobId
                  AND (locked_until IS NULL OR locked_until < :now)
                """,
            params
        );
        if (updated > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO continuation_messages (job_id, run_at, delivery_count, created_at, updated_at)
                    VALUES (:jobId, :runAt, 0, :now, :now)
                    """,
                params
            );
        } catch (DuplicateKeyException e) {
            // The in-flight invocation decides whether the job continues.
            log.debug("Continuation for job {} already in flight; not enqueued again", jobId);
        }
    }

    @Override
    public Optional<ContinuationMessage> claimNext(String lockOwner, long lockTtlSeconds) {
        Instant now = clock.instant();
        Instant lockedUntil = now.plusSeconds(Math.max(1, lockTtlSeconds));
        String safeOwner = (lockOwner == null || lockOwner.isBlank()) ? "unknown" : lockOwner.trim();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", Timestamp.from(now))
            .addValue("lockedUntil", Timestamp.from(lockedUntil))
            .addValue("lockOwner", safeOwner);

        if (postgres) {
            List<ContinuationMessage> claimed = jdbc.query(
                """
                    WITH candidate AS (
                        SELECT id
                        FROM continuation_messages
                        WHERE run_at <= :now
                          AND (locked_until IS NULL OR locked_until < :now)
                        ORDER BY run_at ASC
                        FOR UPDATE SKIP LOCKED
                        LIMIT 1
                    )
                    UPDATE continuation_messages cm
                    SET locked_until = :lockedUntil,
                        lock_owner = :lockOwner,
                        delivery_count = cm.delivery_count + 1,
                        updated_at = :now
                    FROM candidate
                    WHERE cm.id = candidate.id
                    RETURNING cm.id, cm.job_id, cm.run_at, cm.delivery_count
                    """,
                params,
                messageMapper
            );
            return claimed.isEmpty() ? Optional.empty() : Optional.of(claimed.get(0));
        }

        List<Long> candidates = jdbc.query(
            """
                SELECT id
                FROM continuation_messages
                WHERE run_at <= :now
                  AND (locked_until IS NULL OR locked_until < :now)
                ORDER BY run_at ASC
                LIMIT 1
                """,
            params,
            (rs, rowNum) -> rs.getLong("id")
        );
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        params.addValue("id", candidates.get(0));
        int updated = jdbc.update(
            """
                UPDATE continuation_messages
                SET locked_until = :lockedUntil,
                    lock_owner = :lockOwner,
                    delivery_count = delivery_count + 1,
                    updated_at = :now
                WHERE id = :id
                  AND (locked_until IS NULL OR locked_until < :now)
                """,
            params
        );
        if (updated == 0) {
            return Optional.empty();
        }
        List<ContinuationMessage> claimed = jdbc.query(
            """
                SELECT id, job_id, run_at, delivery_count
                FROM continuation_messages
                WHERE id = :id
                """,
            params,
            messageMapper
        );
        return claimed.isEmpty() ? Optional.empty() : Optional.of(claimed.get(0));
    }

    @Override
    public void reschedule(long messageId, Duration delay) {
        Instant now = clock.instant();
        jdbc.update(
            """
                UPDATE continuation_messages
                SET run_at = :runAt,
                    locked_until = NULL,
                    lock_owner = NULL,
                    delivery_count = 0,
                    last_error = NULL,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", messageId)
                .addValue("runAt", Timestamp.from(now.plus(nonNegative(delay))))
                .addValue("now", Timestamp.from(now))
        );
    }

    @Override
    public void acknowledge(long messageId) {
        jdbc.update(
            "DELETE FROM continuation_messages WHERE id = :id",
            new MapSqlParameterSource().addValue("id", messageId)
        );
    }

    @Override
    public void release(long messageId, Duration retryDelay, String error) {
        Instant now = clock.instant();
        jdbc.update(
            """
                UPDATE continuation_messages
                SET run_at = :runAt,
                    locked_until = NULL,
                    lock_owner = NULL,
                    last_error = :error,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", messageId)
                .addValue("runAt", Timestamp.from(now.plus(nonNegative(retryDelay))))
                .addValue("error", truncate(error))
                .addValue("now", Timestamp.from(now))
        );
    }

    @Override
    public boolean hasMessage(UUID jobId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM continuation_messages WHERE job_id = :jobId",
            new MapSqlParameterSource().addValue("jobId", jobId),
            Integer.class
        );
        return count != null && count > 0;
    }

    private Duration nonNegative(Duration delay) {
        return delay == null || delay.isNegative() ? Duration.ZERO : delay;
    }

    private String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; claiming continuations without SKIP LOCKED", e);
            return false;
        }
    }
}
