package com.delta.creatorscout.discovery.persistence;

import com.delta.creatorscout.discovery.model.ContinuationMessage;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

public interface ContinuationQueue {
    void enqueue(UUID jobId, Duration delay);

    Optional<ContinuationMessage> claimNext(String lockOwner, long lockTtlSeconds);

    void reschedule(long messageId, Duration delay);

    void acknowledge(long messageId);

    void release(long messageId, Duration retryDelay, String error);

    boolean hasMessage(UUID jobId);
}
