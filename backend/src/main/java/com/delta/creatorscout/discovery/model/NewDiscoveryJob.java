package com.delta.creatorscout.discovery.model;

import java.time.Instant;
import java.util.List;

public record NewDiscoveryJob(
    String accountId,
    Platform platform,
    SearchMode mode,
    List<String> keywords,
    String seedHandle,
    String region,
    int targetResultCount,
    int maxApiCalls,
    Instant timeoutAt
) {
    public NewDiscoveryJob {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
