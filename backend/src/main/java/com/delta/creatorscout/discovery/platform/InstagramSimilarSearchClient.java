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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class InstagramSimilarSearchClient extends ScrapeCreatorsSupport implements PlatformSearchClient {
    private static final String PROFILE_PATH = "/v1/instagram/profile";
    private static final SearchVariant VARIANT = new SearchVariant(Platform.INSTAGRAM, SearchMode.SIMILAR_TO_SEED);

    public InstagramSimilarSearchClient(
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
        if (rawCursor != null && !rawCursor.isBlank()) {
            return new SearchPage(List.of(), null, false, null);
        }
        try {
            ApiResponse response = get(PROFILE_PATH, params("handle", seed), null);
            JsonNode related = relatedProfiles(response.root());
            List<CandidateCreator> candidates = new ArrayList<>();
            for (JsonNode profile : related) {
                JsonNode node = profile.has("node") ? profile.path("node") : profile;
                CandidateCreator candidate = toCandidate(node);
                if (candidate != null && !seed.equalsIgnoreCase(candidate.handle())) {
                    candidates.add(candidate);
                }
            }
            return new SearchPage(candidates, null, false, response.quotaRemainingRatio());
        } catch (MalformedPayloadException e) {
            throw malformedDependent(VARIANT.toString(), e);
        }
    }

    private static JsonNode relatedProfiles(JsonNode root) {
        if (root.path("relatedProfiles").isArray()) {
            return root.path("relatedProfiles");
        }
        JsonNode user = root.path("data").path("user");
        if (!user.isObject()) {
            throw new MalformedPayloadException("seed profile has no 'data.user' object", null);
        }
        JsonNode edges = user.path("edge_related_profiles").path("edges");
        if (edges.isMissingNode() || edges.isNull()) {
            return JsonNodeFactory.instance.arrayNode();
        }
        if (!edges.isArray()) {
            throw new MalformedPayloadException("related profiles are not an array", null);
        }
        return edges;
    }

    static CandidateCreator toCandidate(JsonNode profile) {
        if (profile == null || !profile.isObject()) {
            return null;
        }
        String handle = text(profile, "username");
        String userId = text(profile, "id", "pk");
        if (userId == null) {
            userId = handle;
        }
        if (userId == null) {
            return null;
        }
        return new CandidateCreator(
            userId,
            handle,
            TextSanitizer.clean(text(profile, "full_name", "fullName")),
            flag(profile, "is_verified", "verified"),
            flag(profile, "is_private", "private"),
            number(profile, "follower_count", "followers_count", "followers"),
            null
        );
    }
}
