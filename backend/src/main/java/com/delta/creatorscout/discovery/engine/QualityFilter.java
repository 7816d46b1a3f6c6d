package com.delta.creatorscout.discovery.engine;

import com.delta.creatorscout.discovery.model.CandidateCreator;
import com.delta.creatorscout.discovery.model.EnrichedCandidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class QualityFilter {
    static final long STAGE_TWO_MIN_FOLLOWERS = 300;
    static final long STAGE_TWO_MIN_PUBLIC_FOLLOWERS = 50;

    private QualityFilter() {}

    public static boolean passesStageOne(CandidateCreator candidate) {
        if (candidate == null) {
            return false;
        }
        return candidate.verified() || (!candidate.privateAccount() && candidate.hasHandle());
    }

    public static boolean passesStageTwo(EnrichedCandidate enriched) {
        CandidateCreator candidate = enriched.candidate();
        long followers = enriched.followerCount();
        return candidate.verified()
            || followers >= STAGE_TWO_MIN_FOLLOWERS
            || (!candidate.privateAccount() && followers >= STAGE_TWO_MIN_PUBLIC_FOLLOWERS)
            || enriched.businessAccount();
    }

    public static double engagementRate(long likes, long comments, long followers) {
        if (followers <= 0) {
            return 0.0;
        }
        return (double) (likes + comments) / followers * 100.0;
    }

    public static double score(boolean verified, long followers, boolean privateAccount, boolean hasHandle, double engagementRate) {
        double score = verified ? 1000 : 0;
        score += Math.min(followers / 1000.0, 500);
        score += privateAccount ? 0 : 50;
        score += hasHandle ? 25 : 0;
        score += Math.min(engagementRate * 10, 100);
        return score;
    }

    public static double score(CandidateCreator candidate) {
        double engagement = engagementRate(candidate.likes(), candidate.comments(), candidate.followerCount());
        return score(
            candidate.verified(),
            candidate.followerCount(),
            candidate.privateAccount(),
            candidate.hasHandle(),
            engagement
        );
    }

    /**
     * Stage one plus deduplication, in page order. Admitted identities are added to the ledger.
     */
    public static List<CandidateCreator> admit(List<CandidateCreator> page, DeduplicationLedger ledger) {
        List<CandidateCreator> admitted = new ArrayList<>();
        if (page == null) {
            return admitted;
        }
        for (CandidateCreator candidate : page) {
            if (!passesStageOne(candidate) || ledger.contains(candidate.platformUserId())) {
                continue;
            }
            if (ledger.admit(candidate.platformUserId())) {
                admitted.add(candidate);
            }
        }
        return admitted;
    }

    public static List<CandidateCreator> prioritize(List<CandidateCreator> candidates) {
        List<CandidateCreator> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingDouble((CandidateCreator c) -> score(c)).reversed());
        return ordered;
    }
}
