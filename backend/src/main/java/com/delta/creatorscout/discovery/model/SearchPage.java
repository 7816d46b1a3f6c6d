package com.delta.creatorscout.discovery.model;

import java.util.List;

public record SearchPage(
    List<CandidateCreator> candidates,
    String nextCursor,
    boolean hasMore,
    Double quotaRemainingRatio
) {
    public SearchPage {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
