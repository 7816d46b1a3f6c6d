package com.delta.creatorscout.discovery.model;

public record ProfileEnrichment(
    String biography,
    Long followerCount,
    boolean businessAccount
) {
}
