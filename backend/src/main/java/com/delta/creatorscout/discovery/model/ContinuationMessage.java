package com.delta.creatorscout.discovery.model;

import java.time.Instant;
import java.util.UUID;

public record ContinuationMessage(long id, UUID jobId, Instant runAt, int deliveryCount) {
}
