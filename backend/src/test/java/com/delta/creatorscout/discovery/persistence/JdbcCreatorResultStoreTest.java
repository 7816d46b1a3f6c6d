package com.delta.creatorscout.discovery.persistence;

import com.delta.creatorscout.discovery.model.CreatorRecord;
import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.model.EnrichmentStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcCreatorResultStoreTest {

    @Autowired
    private DiscoveryJobStore jobStore;

    @Autowired
    private CreatorResultStore resultStore;

    @Test
    void trimKeepsEarliestAdmissionsRegardlessOfSaveOrder() {
        DiscoveryJob job = jobStore.insert(PersistenceFixtures.keywordJob(3, 5), Instant.now());
        resultStore.saveAll(job.id(), List.of(
            PersistenceFixtures.creator("d", 3, EnrichmentStatus.COMPLETED),
            PersistenceFixtures.creator("a", 0, EnrichmentStatus.COMPLETED),
            PersistenceFixtures.creator("e", 4, EnrichmentStatus.SKIPPED),
            PersistenceFixtures.creator("c", 2, EnrichmentStatus.SKIPPED),
            PersistenceFixtures.creator("b", 1, EnrichmentStatus.COMPLETED)
        ));

        int deleted = resultStore.trimToFirst(job.id(), 3);

        assertThat(deleted).isEqualTo(2);
        assertThat(resultStore.findByJob(job.id()))
            .extracting(CreatorRecord::platformUserId)
            .containsExactly("a", "b", "c");
    }

    @Test
    void trimBelowCountLeavesEverything() {
        DiscoveryJob job = jobStore.insert(PersistenceFixtures.keywordJob(10, 5), Instant.now());
        resultStore.saveAll(job.id(), List.of(
            PersistenceFixtures.creator("a", 0, EnrichmentStatus.COMPLETED),
            PersistenceFixtures.creator("b", 1, EnrichmentStatus.COMPLETED)
        ));

        assertThat(resultStore.trimToFirst(job.id(), 10)).isZero();
        assertThat(resultStore.countCounted(job.id())).isEqualTo(2);
    }

    @Test
    void pendingEntriesAreNotCountedUntilEnriched() {
        DiscoveryJob job = jobStore.insert(PersistenceFixtures.keywordJob(10, 5), Instant.now());
        resultStore.saveAll(job.id(), List.of(
            PersistenceFixtures.creator("a", 0, EnrichmentStatus.COMPLETED),
            PersistenceFixtures.creator("b", 1, EnrichmentStatus.PENDING),
            PersistenceFixtures.creator("c", 2, EnrichmentStatus.PENDING)
        ));
        assertThat(resultStore.countCounted(job.id())).isEqualTo(1);

        resultStore.saveAll(job.id(), List.of(PersistenceFixtures.creator("b", 1, EnrichmentStatus.COMPLETED)));
        assertThat(resultStore.countCounted(job.id())).isEqualTo(2);

        assertThat(resultStore.deleteUndelivered(job.id())).isEqualTo(1);
        List<CreatorRecord> remaining = resultStore.findByJob(job.id());
        assertThat(remaining).extracting(CreatorRecord::platformUserId).containsExactly("a", "b");
        CreatorRecord enriched = remaining.get(1);
        assertThat(enriched.emails()).containsExactly("b@studio.example");
        assertThat(enriched.source().hashtags()).containsExactly("mealprep");
        assertThat(enriched.admissionOrder()).isEqualTo(1);
    }

    @Test
    void rejectedMarkersStayInTheJobButAreNeverCountedOrDelivered() {
        DiscoveryJob job = jobStore.insert(PersistenceFixtures.keywordJob(10, 5), Instant.now());
        resultStore.saveAll(job.id(), List.of(
            PersistenceFixtures.creator("a", 0, EnrichmentStatus.COMPLETED),
            PersistenceFixtures.creator("b", 1, EnrichmentStatus.REJECTED),
            PersistenceFixtures.creator("c", 2, EnrichmentStatus.PENDING)
        ));

        assertThat(resultStore.countCounted(job.id())).isEqualTo(1);
        assertThat(resultStore.findByJob(job.id()))
            .extracting(CreatorRecord::platformUserId)
            .containsExactly("a", "b", "c");

        assertThat(resultStore.deleteUndelivered(job.id())).isEqualTo(2);
        assertThat(resultStore.findByJob(job.id())).extracting(CreatorRecord::platformUserId).containsExactly("a");
    }
}
