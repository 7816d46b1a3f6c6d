package com.delta.creatorscout.discovery.model;

import java.util.List;

public record SourceContent(
    String contentId,
    String caption,
    String url,
    long likes,
    long comments,
    long views,
    long shares,
    List<String> hashtags
) {
    public SourceContent {
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
    }
}
