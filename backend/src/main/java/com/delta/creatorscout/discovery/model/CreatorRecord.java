package com.delta.creatorscout.discovery.model;

import java.util.List;

public record CreatorRecord(
    String platformUserId,
    String handle,
    String displayName,
    boolean verified,
    boolean privateAccount,
    long followerCount,
    boolean businessAccount,
    double qualityScore,
    double engagementRate,
    String biography,
    List<String> emails,
    EnrichmentStatus enrichmentStatus,
    long admissionOrder,
    SourceContent source
) {
    public CreatorRecord {
        emails = emails == null ? List.of() : List.copyOf(emails);
    }

    public boolean isCounted() {
        return enrichmentStatus == EnrichmentStatus.COMPLETED || enrichmentStatus == EnrichmentStatus.SKIPPED;
    }

    public boolean isPending() {
        return enrichmentStatus == EnrichmentStatus.PENDING;
    }

    public CandidateCreator toCandidate() {
        return new CandidateCreator(platformUserId, handle, displayName, verified, privateAccount, followerCount, source);
    }
}
