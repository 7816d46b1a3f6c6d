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
import com.delta.creatorscout.discovery.util.TextSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class TikTokSimilarSearchClient extends ScrapeCreatorsSupport implements PlatformSearchClient {
    private static final String PROFILE_PATH = "/v1/tiktok/profile";
    private static final String USER_SEARCH_PATH = "/v1/tiktok/search/users";
    private static final SearchVariant VARIANT = new SearchVariant(Platform.TIKTOK, SearchMode.SIMILAR_TO_SEED);

    public TikTokSimilarSearchClient(
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
            return resolveSeed(job, seed, cursor);
        }
        List<String> queries = cursor.queries();
        if (cursor.keywordIndex() >= queries.size()) {
            return new SearchPage(List.of(), null, false, null);
        }
        SearchCursor nextQuery = cursor.keywordIndex() + 1 < queries.size() ? cursor.nextKeyword() : null;
        try {
            ApiResponse response = get(
                USER_SEARCH_PATH,
                params("query", queries.get(cursor.keywordIndex()), "cursor", cursor.offset(), "region", regionOf(job)),
                null
            );
            JsonNode users = requireArray(response.root(), "users");
            List<CandidateCreator> candidates = new ArrayList<>();
            for (JsonNode user : users) {
                CandidateCreator candidate = toCandidate(user.path("user_info"));
                if (candidate != null && !seed.equalsIgnoreCase(candidate.handle())) {
                    candidates.add(candidate);
                }
            }
            boolean hasMore = flag(response.root(), "has_more");
            SearchCursor next;
            if (hasMore && !users.isEmpty()) {
                long apiCursor = number(response.root(), "cursor");
                next = cursor.withOffset(apiCursor > cursor.offset() ? apiCursor : cursor.offset() + users.size());
            } else {
                next = nextQuery;
            }
            return new SearchPage(
                candidates,
                next == null ? null : next.encode(objectMapper),
                next != null,
                response.quotaRemainingRatio()
            );
        } catch (MalformedPayloadException e) {
            throw malformed(VARIANT.toString(), e, nextQuery);
        }
    }

    private SearchPage resolveSeed(DiscoveryJob job, String seed, SearchCursor cursor) {
        try {
            ApiResponse response = get(PROFILE_PATH, params("handle", seed, "region", regionOf(job)), null);
            JsonNode user = response.root().path("user");
            if (!user.isObject()) {
                throw new MalformedPayloadException("seed profile has no 'user' object", null);
            }
            List<String> queries = SeedQueries.derive(
                seed,
                text(user, "nickname"),
                text(user, "signature")
            );
            SearchCursor next = cursor.withQueries(queries);
            return new SearchPage(List.of(), next.encode(objectMapper), !queries.isEmpty(), response.quotaRemainingRatio());
        } catch (MalformedPayloadException e) {
            throw malformedDependent(VARIANT.toString(), e);
        }
    }

    static CandidateCreator toCandidate(JsonNode userInfo) {
        if (userInfo == null || !userInfo.isObject()) {
            return null;
        }
        String handle = text(userInfo, "unique_id");
        String userId = text(userInfo, "uid", "sec_uid");
        if (userId == null) {
            userId = handle;
        }
        if (userId == null) {
            return null;
        }
        return new CandidateCreator(
            userId,
            handle,
            TextSanitizer.clean(text(userInfo, "nickname")),
            number(userInfo, "verification_type") > 0 || flag(userInfo, "is_verified"),
            flag(userInfo, "is_private_account", "secret"),
            number(userInfo, "follower_count"),
            null
        );
    }
}
