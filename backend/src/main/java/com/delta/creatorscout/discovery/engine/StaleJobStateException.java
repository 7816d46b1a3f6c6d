package com.delta.creatorscout.discovery.engine;

import java.util.UUID;

public class StaleJobStateException extends RuntimeException {
    public StaleJobStateException(UUID jobId, long expectedVersion) {
        super("Discovery job " + jobId + " changed since version " + expectedVersion);
    }
}
