package com.delta.creatorscout.discovery.persistence;

import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.model.JobProgressUpdate;
import com.delta.creatorscout.discovery.model.NewDiscoveryJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DiscoveryJobStore {
    DiscoveryJob insert(NewDiscoveryJob job, Instant now);

    Optional<DiscoveryJob> findById(UUID jobId);

    /**
     * Applies the update only when the stored version still equals {@code expectedVersion}.
     *
     * @return false when another invocation committed first
     */
    boolean commit(UUID jobId, long expectedVersion, JobProgressUpdate update, Instant now);

    List<DiscoveryJob> findNonTerminal(int limit);
}
