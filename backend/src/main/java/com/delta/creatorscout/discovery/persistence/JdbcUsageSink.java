package com.delta.creatorscout.discovery.persistence;

import com.delta.creatorscout.discovery.model.UsageEvent;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcUsageSink implements UsageSink {
    private final NamedParameterJdbcTemplate jdbc;

    public JdbcUsageSink(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean record(UsageEvent event) {
        if (findByJob(event.jobId()).isPresent()) {
            return false;
        }
        jdbc.update(
            """
                INSERT INTO usage_events (job_id, account_id, result_count, recorded_at)
                VALUES (:jobId, :accountId, :resultCount, :recordedAt)
                """,
            new MapSqlParameterSource()
                .addValue("jobId", event.jobId())
                .addValue("accountId", event.accountId())
                .addValue("resultCount", event.resultCount())
                .addValue("recordedAt", Timestamp.from(event.recordedAt()))
        );
        return true;
    }

    @Override
    public Optional<UsageEvent> findByJob(UUID jobId) {
        List<UsageEvent> events = jdbc.query(
            """
                SELECT job_id, account_id, result_count, recorded_at
                FROM usage_events
                WHERE job_id = :jobId
                """,
            new MapSqlParameterSource().addValue("jobId", jobId),
            (rs, rowNum) -> new UsageEvent(
                rs.getString("account_id"),
                rs.getInt("result_count"),
                rs.getObject("job_id", UUID.class),
                rs.getTimestamp("recorded_at").toInstant()
            )
        );
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(0));
    }
}
