package com.delta.creatorscout.discovery.persistence;

import com.delta.creatorscout.discovery.model.CreatorRecord;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface CreatorResultStore {
    List<CreatorRecord> findByJob(UUID jobId);

    void saveAll(UUID jobId, Collection<CreatorRecord> records);

    /**
     * Removes entries that are never delivered: deferred ({@code PENDING}) and {@code REJECTED}.
     */
    int deleteUndelivered(UUID jobId);

    int countCounted(UUID jobId);

    /**
     * Keeps the first {@code keep} entries in admission order and deletes the rest.
     */
    int trimToFirst(UUID jobId, int keep);
}
