package com.delta.creatorscout.discovery.platform;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.http.PoliteHttpClient;
import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.model.FailureKind;
import com.delta.creatorscout.discovery.model.Platform;
import com.delta.creatorscout.discovery.model.SearchMode;
import com.delta.creatorscout.discovery.model.SearchPage;
import com.delta.creatorscout.discovery.model.SearchVariant;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class YouTubeKeywordSearchClient extends YouTubeVideoSearchSupport implements PlatformSearchClient {
    private static final SearchVariant VARIANT = new SearchVariant(Platform.YOUTUBE, SearchMode.KEYWORD);

    public YouTubeKeywordSearchClient(
        DiscoveryProperties properties,
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        super(properties, httpClient, objectMapper);
    }

    @Override
    public SearchVariant variant() {
        return VARIANT;
    }

    @Override
    public SearchPage fetchPage(DiscoveryJob job, String rawCursor) {
        if (job.keywords().isEmpty()) {
            throw new PlatformFetchException(FailureKind.FATAL, "keyword search requires at least one keyword");
        }
        return searchVideos(VARIANT.toString(), job.keywords(), SearchCursor.decode(objectMapper, rawCursor));
    }
}
