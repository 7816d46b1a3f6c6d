package com.delta.creatorscout.discovery.engine;

import com.delta.creatorscout.discovery.model.CandidateCreator;
import com.delta.creatorscout.discovery.model.EnrichedCandidate;

import java.util.List;

public record EnrichmentBatchResult(List<EnrichedCandidate> enriched, List<CandidateCreator> deferred, int failures) {
    public EnrichmentBatchResult {
        enriched = enriched == null ? List.of() : List.copyOf(enriched);
        deferred = deferred == null ? List.of() : List.copyOf(deferred);
    }
}
