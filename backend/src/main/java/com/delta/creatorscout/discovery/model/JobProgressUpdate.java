package com.delta.creatorscout.discovery.model;

import java.time.Instant;

public record JobProgressUpdate(
    JobStatus status,
    int apiCallsMade,
    int uniqueResultsCollected,
    String resumeCursor,
    boolean searchExhausted,
    int progressPercent,
    int consecutiveFailures,
    String error,
    Instant startedAt,
    Instant completedAt
) {
}
