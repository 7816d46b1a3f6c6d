package com.delta.creatorscout.discovery.platform;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.http.PoliteHttpClient;
import com.delta.creatorscout.discovery.model.CandidateCreator;
import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.model.FailureKind;
import com.delta.creatorscout.discovery.model.Platform;
import com.delta.creatorscout.discovery.model.SearchMode;
import com.delta.creatorscout.discovery.model.SearchPage;
import com.delta.creatorscout.discovery.model.SearchVariant;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class YouTubeSimilarSearchClient extends YouTubeVideoSearchSupport implements PlatformSearchClient {
    private static final String CHANNEL_PATH = "/v1/youtube/channel";
    private static final SearchVariant VARIANT = new SearchVariant(Platform.YOUTUBE, SearchMode.SIMILAR_TO_SEED);

    public YouTubeSimilarSearchClient(
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
        String seed = SeedQueries.normalizeHandle(job.seedHandle());
        if (seed == null || seed.isBlank()) {
            throw new PlatformFetchException(FailureKind.FATAL, "similar search requires a seed handle");
        }
        SearchCursor cursor = SearchCursor.decode(objectMapper, rawCursor);
        if (cursor.queries() == null) {
            return resolveSeed(seed, cursor);
        }
        SearchPage page = searchVideos(VARIANT.toString(), cursor.queries(), cursor);
        List<CandidateCreator> others = new ArrayList<>();
        for (CandidateCreator candidate : page.candidates()) {
            if (!seed.equalsIgnoreCase(SeedQueries.normalizeHandle(candidate.handle()))) {
                others.add(candidate);
            }
        }
        return new SearchPage(others, page.nextCursor(), page.hasMore(), page.quotaRemainingRatio());
    }

    private SearchPage resolveSeed(String seed, SearchCursor cursor) {
        try {
            ApiResponse response = get(CHANNEL_PATH, params("handle", seed), null);
            JsonNode root = response.root();
            List<String> queries = SeedQueries.derive(seed, text(root, "name", "title"), text(root, "description"));
            SearchCursor next = cursor.withQueries(queries);
            return new SearchPage(List.of(), next.encode(objectMapper), !queries.isEmpty(), response.quotaRemainingRatio());
        } catch (MalformedPayloadException e) {
            throw malformedDependent(VARIANT.toString(), e);
        }
    }
}
