package com.delta.creatorscout.discovery.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record DiscoveryJob(
    UUID id,
    String accountId,
    Platform platform,
    SearchMode mode,
    List<String> keywords,
    String seedHandle,
    String region,
    int targetResultCount,
    int maxApiCalls,
    int apiCallsMade,
    int uniqueResultsCollected,
    String resumeCursor,
    boolean searchExhausted,
    int progressPercent,
    JobStatus status,
    int consecutiveFailures,
    String error,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant updatedAt,
    Instant timeoutAt,
    long version
) {
    public DiscoveryJob {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public SearchVariant searchVariant() {
        return new SearchVariant(platform, mode);
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public boolean hasCallBudgetLeft() {
        return apiCallsMade < maxApiCalls;
    }
}
