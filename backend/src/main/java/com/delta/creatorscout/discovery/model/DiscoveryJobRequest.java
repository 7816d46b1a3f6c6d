package com.delta.creatorscout.discovery.model;

import java.util.List;

public record DiscoveryJobRequest(
    String accountId,
    String platform,
    String mode,
    List<String> keywords,
    String seedHandle,
    String region,
    Integer targetResultCount,
    Integer maxApiCalls
) {
}
