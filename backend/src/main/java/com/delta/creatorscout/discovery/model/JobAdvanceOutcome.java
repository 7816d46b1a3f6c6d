package com.delta.creatorscout.discovery.model;

import java.util.UUID;

public record JobAdvanceOutcome(
    UUID jobId,
    AdvanceAction action,
    JobStatus status,
    int apiCallsMade,
    int resultsCollected,
    int progressPercent,
    ContinuationRequest continuation
) {
    public static JobAdvanceOutcome of(DiscoveryJob job, AdvanceAction action, ContinuationRequest continuation) {
        return new JobAdvanceOutcome(
            job.id(),
            action,
            job.status(),
            job.apiCallsMade(),
            job.uniqueResultsCollected(),
            job.progressPercent(),
            continuation
        );
    }

    public boolean hasContinuation() {
        return continuation != null;
    }
}
