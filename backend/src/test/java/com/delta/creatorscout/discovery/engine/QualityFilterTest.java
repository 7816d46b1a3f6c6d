package com.delta.creatorscout.discovery.engine;

import com.delta.creatorscout.discovery.model.CandidateCreator;
import com.delta.creatorscout.discovery.model.EnrichedCandidate;
import com.delta.creatorscout.discovery.model.EnrichmentStatus;
import com.delta.creatorscout.discovery.model.SourceContent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QualityFilterTest {

    @Test
    void stageOneAdmitsVerifiedOrPublicWithHandle() {
        assertThat(QualityFilter.passesStageOne(candidate("1", "alice", false, false, 0))).isTrue();
        assertThat(QualityFilter.passesStageOne(candidate("2", "bob", false, true, 0))).isFalse();
        assertThat(QualityFilter.passesStageOne(candidate("3", " ", false, false, 0))).isFalse();
        assertThat(QualityFilter.passesStageOne(candidate("4", null, true, true, 0))).isTrue();
    }

    @Test
    void stageTwoUsesEnrichedFollowerCounts() {
        CandidateCreator privateSmall = candidate("1", "a", false, true, 100);
        CandidateCreator publicSmall = candidate("2", "b", false, false, 40);

        assertThat(QualityFilter.passesStageTwo(enriched(privateSmall, 100, false))).isFalse();
        assertThat(QualityFilter.passesStageTwo(enriched(privateSmall, 300, false))).isTrue();
        assertThat(QualityFilter.passesStageTwo(enriched(publicSmall, 49, false))).isFalse();
        assertThat(QualityFilter.passesStageTwo(enriched(publicSmall, 50, false))).isTrue();
        assertThat(QualityFilter.passesStageTwo(enriched(publicSmall, 0, true))).isTrue();
    }

    @Test
    void scoreFollowsWeightedFormula() {
        // 1000 verified + min(250000/1000, 500) + 50 public + 25 handle + min(2.0 * 10, 100)
        double score = QualityFilter.score(true, 250_000, false, true, 2.0);
        assertThat(score).isEqualTo(1000 + 250 + 50 + 25 + 20);
        assertThat(QualityFilter.score(false, 10_000_000, true, false, 50.0)).isEqualTo(500 + 100);
    }

    @Test
    void engagementRateIsZeroWithoutFollowers() {
        assertThat(QualityFilter.engagementRate(100, 20, 0)).isZero();
        assertThat(QualityFilter.engagementRate(90, 10, 1000)).isEqualTo(10.0);
    }

    @Test
    void admitDropsDuplicatesWithinPageAndAgainstLedger() {
        DeduplicationLedger ledger = DeduplicationLedger.rebuild(List.of());
        ledger.admit("seen");
        List<CandidateCreator> page = List.of(
            candidate("a", "alpha", false, false, 10),
            candidate("seen", "old", false, false, 10),
            candidate("a", "alpha-again", false, false, 10),
            candidate("b", "beta", false, true, 10),
            candidate("c", "gamma", false, false, 10)
        );

        List<CandidateCreator> admitted = QualityFilter.admit(page, ledger);

        assertThat(admitted).extracting(CandidateCreator::platformUserId).containsExactly("a", "c");
        assertThat(ledger.contains("c")).isTrue();
        assertThat(ledger.size()).isEqualTo(3);
    }

    @Test
    void prioritizeOrdersByDescendingScore() {
        CandidateCreator small = candidate("small", "s", false, false, 1_000);
        CandidateCreator verified = candidate("verified", "v", true, false, 10);
        CandidateCreator large = candidate("large", "l", false, false, 400_000);

        assertThat(QualityFilter.prioritize(List.of(small, verified, large)))
            .extracting(CandidateCreator::platformUserId)
            .containsExactly("verified", "large", "small");
    }

    private static CandidateCreator candidate(String id, String handle, boolean verified, boolean isPrivate, long followers) {
        SourceContent source = new SourceContent("v-" + id, "caption", null, 0, 0, 0, 0, List.of());
        return new CandidateCreator(id, handle, handle, verified, isPrivate, followers, source);
    }

    private static EnrichedCandidate enriched(CandidateCreator candidate, long followers, boolean business) {
        return new EnrichedCandidate(candidate, EnrichmentStatus.COMPLETED, null, List.of(), followers, business);
    }
}
