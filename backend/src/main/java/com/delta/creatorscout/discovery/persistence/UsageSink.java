package com.delta.creatorscout.discovery.persistence;

import com.delta.creatorscout.discovery.model.UsageEvent;

import java.util.Optional;
import java.util.UUID;

public interface UsageSink {
    /**
     * @return false when an event for the same job was already recorded
     */
    boolean record(UsageEvent event);

    Optional<UsageEvent> findByJob(UUID jobId);
}
