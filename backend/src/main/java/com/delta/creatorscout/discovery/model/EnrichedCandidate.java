package com.delta.creatorscout.discovery.model;

import java.util.List;

public record EnrichedCandidate(
    CandidateCreator candidate,
    EnrichmentStatus status,
    String biography,
    List<String> emails,
    long followerCount,
    boolean businessAccount
) {
    public EnrichedCandidate {
        emails = emails == null ? List.of() : List.copyOf(emails);
    }

    public static EnrichedCandidate skipped(CandidateCreator candidate) {
        return new EnrichedCandidate(candidate, EnrichmentStatus.SKIPPED, null, List.of(), candidate.followerCount(), false);
    }
}
