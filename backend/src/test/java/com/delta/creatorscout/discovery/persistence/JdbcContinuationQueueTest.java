package com.delta.creatorscout.discovery.persistence;

import com.delta.creatorscout.discovery.model.ContinuationMessage;
import com.delta.creatorscout.discovery.model.DiscoveryJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcContinuationQueueTest {

    @Autowired
    private DiscoveryJobStore jobStore;

    @Autowired
    private ContinuationQueue queue;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @BeforeEach
    void clearQueue() {
        jdbc.update("DELETE FROM continuation_messages", new MapSqlParameterSource());
    }

    @Test
    void repeatedEnqueueKeepsOneMessageAtTheEarliestTime() {
        DiscoveryJob job = jobStore.insert(PersistenceFixtures.keywordJob(10, 5), Instant.now());

        queue.enqueue(job.id(), Duration.ofMinutes(10));
        assertThat(queue.claimNext("worker-a", 60)).isEmpty();

        queue.enqueue(job.id(), Duration.ZERO);
        assertThat(countMessages(job)).isEqualTo(1);
        Optional<ContinuationMessage> claimed = queue.claimNext("worker-a", 60);
        assertThat(claimed).isPresent();
        assertThat(claimed.get().jobId()).isEqualTo(job.id());
        assertThat(claimed.get().deliveryCount()).isEqualTo(1);
    }

    @Test
    void claimedMessageIsNotDeliveredTwice() {
        DiscoveryJob job = jobStore.insert(PersistenceFixtures.keywordJob(10, 5), Instant.now());
        queue.enqueue(job.id(), Duration.ZERO);

        assertThat(queue.claimNext("worker-a", 60)).isPresent();
        assertThat(queue.claimNext("worker-b", 60)).isEmpty();

        queue.enqueue(job.id(), Duration.ZERO);
        assertThat(countMessages(job)).isEqualTo(1);
        assertThat(queue.claimNext("worker-b", 60)).isEmpty();
    }

    @Test
    void releasedMessageIsRedeliveredWithAttemptCount() {
        DiscoveryJob job = jobStore.insert(PersistenceFixtures.keywordJob(10, 5), Instant.now());
        queue.enqueue(job.id(), Duration.ZERO);
        ContinuationMessage first = queue.claimNext("worker-a", 60).orElseThrow();

        queue.release(first.id(), Duration.ZERO, "x".repeat(5000));
        ContinuationMessage second = queue.claimNext("worker-a", 60).orElseThrow();

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(second.deliveryCount()).isEqualTo(2);
        String lastError = jdbc.queryForObject(
            "SELECT last_error FROM continuation_messages WHERE id = :id",
            new MapSqlParameterSource().addValue("id", second.id()),
            String.class
        );
        assertThat(lastError).hasSize(1000);
    }

    @Test
    void rescheduleStartsAFreshDeliveryCycle() {
        DiscoveryJob job = jobStore.insert(PersistenceFixtures.keywordJob(10, 5), Instant.now());
        queue.enqueue(job.id(), Duration.ZERO);
        ContinuationMessage claimed = queue.claimNext("worker-a", 60).orElseThrow();
        queue.release(claimed.id(), Duration.ZERO, "transient");
        claimed = queue.claimNext("worker-a", 60).orElseThrow();

        queue.reschedule(claimed.id(), Duration.ZERO);

        assertThat(queue.claimNext("worker-a", 60)).hasValueSatisfying(
            message -> assertThat(message.deliveryCount()).isEqualTo(1)
        );
    }

    @Test
    void acknowledgeRemovesTheMessage() {
        DiscoveryJob job = jobStore.insert(PersistenceFixtures.keywordJob(10, 5), Instant.now());
        queue.enqueue(job.id(), Duration.ZERO);
        ContinuationMessage claimed = queue.claimNext("worker-a", 60).orElseThrow();

        queue.acknowledge(claimed.id());

        assertThat(queue.hasMessage(job.id())).isFalse();
        assertThat(queue.claimNext("worker-a", 60)).isEmpty();
    }

    private int countMessages(DiscoveryJob job) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM continuation_messages WHERE job_id = :jobId",
            new MapSqlParameterSource().addValue("jobId", job.id()),
            Integer.class
        );
        return count == null ? 0 : count;
    }
}
