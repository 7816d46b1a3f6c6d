package com.delta.creatorscout.discovery.platform;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.http.PoliteHttpClient;
import com.delta.creatorscout.discovery.model.CandidateCreator;
import com.delta.creatorscout.discovery.model.SearchPage;
import com.delta.creatorscout.discovery.model.SourceContent;
import com.delta.creatorscout.discovery.util.TextSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

// Continuation tokens come from the previous payload, so a malformed page cannot be skipped.
abstract class YouTubeVideoSearchSupport extends ScrapeCreatorsSupport {
    private static final String SEARCH_PATH = "/v1/youtube/search";

    protected YouTubeVideoSearchSupport(
        DiscoveryProperties properties,
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        super(properties, httpClient, objectMapper);
    }

    protected SearchPage searchVideos(String variant, List<String> queries, SearchCursor cursor) {
        if (cursor.keywordIndex() >= queries.size()) {
            return new SearchPage(List.of(), null, false, null);
        }
        try {
            ApiResponse response = get(
                SEARCH_PATH,
                params("query", queries.get(cursor.keywordIndex()), "continuationToken", cursor.token()),
                null
            );
            JsonNode videos = requireArray(response.root(), "videos");
            List<CandidateCreator> candidates = new ArrayList<>();
            for (JsonNode video : videos) {
                CandidateCreator candidate = toCandidate(video);
                if (candidate != null) {
                    candidates.add(candidate);
                }
            }
            String token = text(response.root(), "continuationToken");
            SearchCursor next;
            if (token != null && !videos.isEmpty()) {
                next = cursor.withToken(token);
            } else if (cursor.keywordIndex() + 1 < queries.size()) {
                next = cursor.nextKeyword();
            } else {
                next = null;
            }
            return new SearchPage(
                candidates,
                next == null ? null : next.encode(objectMapper),
                next != null,
                response.quotaRemainingRatio()
            );
        } catch (MalformedPayloadException e) {
            throw malformedDependent(variant, e);
        }
    }

    static CandidateCreator toCandidate(JsonNode video) {
        if (video == null || !video.isObject()) {
            return null;
        }
        JsonNode channel = video.path("channel");
        String handle = text(channel, "handle");
        String channelId = text(channel, "id", "channelId");
        if (channelId == null) {
            channelId = handle;
        }
        if (channelId == null) {
            return null;
        }
        SourceContent source = new SourceContent(
            text(video, "id"),
            TextSanitizer.clean(text(video, "title", "description")),
            text(video, "url"),
            0,
            0,
            number(video, "viewCountInt", "viewCount"),
            0,
            textList(video.path("hashtags"))
        );
        return new CandidateCreator(
            channelId,
            handle,
            TextSanitizer.clean(text(channel, "title", "name")),
            flag(channel, "isVerified", "verified"),
            false,
            number(channel, "subscriberCount"),
            source
        );
    }
}
