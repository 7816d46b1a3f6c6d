package com.delta.creatorscout.discovery.model;

public record CandidateCreator(
    String platformUserId,
    String handle,
    String displayName,
    boolean verified,
    boolean privateAccount,
    long followerCount,
    SourceContent source
) {
    public boolean hasHandle() {
        return handle != null && !handle.isBlank();
    }

    public long likes() {
        return source == null ? 0 : source.likes();
    }

    public long comments() {
        return source == null ? 0 : source.comments();
    }
}
