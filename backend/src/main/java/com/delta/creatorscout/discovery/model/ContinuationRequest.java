package com.delta.creatorscout.discovery.model;

import java.time.Duration;
import java.util.UUID;

public record ContinuationRequest(UUID jobId, Duration delay, String reason) {
}
