package com.delta.creatorscout.discovery.api;

import java.util.UUID;

public record ContinuationMessageRequest(UUID jobId) {
}
