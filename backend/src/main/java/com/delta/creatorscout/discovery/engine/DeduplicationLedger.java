package com.delta.creatorscout.discovery.engine;

import com.delta.creatorscout.discovery.model.CreatorRecord;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Identities already admitted for one job. Rebuilt from the persisted result set on every invocation.
 */
public final class DeduplicationLedger {
    private final Set<String> admitted;

    private DeduplicationLedger(Set<String> admitted) {
        this.admitted = admitted;
    }

    public static DeduplicationLedger rebuild(Collection<CreatorRecord> persisted) {
        Set<String> ids = new HashSet<>();
        if (persisted != null) {
            for (CreatorRecord record : persisted) {
                ids.add(record.platformUserId());
            }
        }
        return new DeduplicationLedger(ids);
    }

    public boolean contains(String platformUserId) {
        return platformUserId != null && admitted.contains(platformUserId);
    }

    public boolean admit(String platformUserId) {
        if (platformUserId == null || platformUserId.isBlank()) {
            return false;
        }
        return admitted.add(platformUserId);
    }

    public int size() {
        return admitted.size();
    }
}
