package com.delta.creatorscout.discovery.engine;

import java.util.UUID;

public class JobNotFoundException extends RuntimeException {
    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Discovery job " + jobId + " does not exist");
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
