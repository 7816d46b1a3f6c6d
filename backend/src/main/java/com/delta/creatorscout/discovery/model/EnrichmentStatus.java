package com.delta.creatorscout.discovery.model;

public enum EnrichmentStatus {
    PENDING,
    COMPLETED,
    SKIPPED,
    // failed the post-enrichment check; kept so the creator is not admitted again
    REJECTED
}
