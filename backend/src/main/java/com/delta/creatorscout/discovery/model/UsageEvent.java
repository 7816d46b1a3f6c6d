package com.delta.creatorscout.discovery.model;

import java.time.Instant;
import java.util.UUID;

public record UsageEvent(String accountId, int resultCount, UUID jobId, Instant recordedAt) {
}
