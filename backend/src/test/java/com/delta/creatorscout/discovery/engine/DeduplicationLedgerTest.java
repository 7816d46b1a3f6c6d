package com.delta.creatorscout.discovery.engine;

import com.delta.creatorscout.discovery.model.CreatorRecord;
import com.delta.creatorscout.discovery.model.EnrichmentStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeduplicationLedgerTest {

    @Test
    void rebuildIncludesPendingEntries() {
        DeduplicationLedger ledger = DeduplicationLedger.rebuild(List.of(
            record("u1", EnrichmentStatus.COMPLETED),
            record("u2", EnrichmentStatus.PENDING)
        ));

        assertTrue(ledger.contains("u1"));
        assertTrue(ledger.contains("u2"));
        assertEquals(2, ledger.size());
    }

    @Test
    void admitRejectsRepeatsAndBlankIds() {
        DeduplicationLedger ledger = DeduplicationLedger.rebuild(null);

        assertTrue(ledger.admit("x"));
        assertFalse(ledger.admit("x"));
        assertFalse(ledger.admit(" "));
        assertFalse(ledger.admit(null));
        assertFalse(ledger.contains(null));
        assertEquals(1, ledger.size());
    }

    private static CreatorRecord record(String id, EnrichmentStatus status) {
        return new CreatorRecord(id, id, id, false, false, 0, false, 0, 0, null, List.of(), status, 0, null);
    }
}
