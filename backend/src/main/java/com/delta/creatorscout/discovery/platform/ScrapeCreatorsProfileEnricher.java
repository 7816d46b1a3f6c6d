package com.delta.creatorscout.discovery.platform;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.http.PoliteHttpClient;
import com.delta.creatorscout.discovery.model.CandidateCreator;
import com.delta.creatorscout.discovery.model.FailureKind;
import com.delta.creatorscout.discovery.model.Platform;
import com.delta.creatorscout.discovery.model.ProfileEnrichment;
import com.delta.creatorscout.discovery.util.TextSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ScrapeCreatorsProfileEnricher extends ScrapeCreatorsSupport implements ProfileEnricher {
    private static final String TIKTOK_PROFILE_PATH = "/v1/tiktok/profile";
    private static final String INSTAGRAM_PROFILE_PATH = "/v1/instagram/basic-profile";
    private static final String YOUTUBE_CHANNEL_PATH = "/v1/youtube/channel";

    public ScrapeCreatorsProfileEnricher(
        DiscoveryProperties properties,
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        super(properties, httpClient, objectMapper);
    }

    @Override
    protected int maxAttempts() {
        return 1 + properties.getRequestMaxRetries();
    }

    @Override
    public ProfileEnrichment enrich(Platform platform, CandidateCreator candidate, Duration timeout) {
        try {
            return switch (platform) {
                case TIKTOK -> tiktok(candidate, timeout);
                case INSTAGRAM -> instagram(candidate, timeout);
                case YOUTUBE -> youtube(candidate, timeout);
            };
        } catch (PlatformFetchException e) {
            throw new PlatformFetchException(FailureKind.ENRICHMENT_FAILURE, e.getMessage(), e);
        } catch (MalformedPayloadException e) {
            throw new PlatformFetchException(FailureKind.ENRICHMENT_FAILURE, "profile payload: " + e.getMessage(), e);
        }
    }

    private ProfileEnrichment tiktok(CandidateCreator candidate, Duration timeout) {
        String handle = requireHandle(candidate);
        JsonNode root = get(
            TIKTOK_PROFILE_PATH,
            params("handle", handle, "region", properties.getProvider().getRegion()),
            timeout
        ).root();
        JsonNode user = root.path("user");
        JsonNode stats = root.path("stats");
        if (!user.isObject()) {
            throw new MalformedPayloadException("missing 'user' object", null);
        }
        String biography = TextSanitizer.clean(text(user, "signature", "desc"));
        Long followers = stats.has("followerCount") ? number(stats, "followerCount") : null;
        boolean business = flag(user.path("commerceUserInfo"), "commerceUser") || flag(user, "ttSeller");
        return new ProfileEnrichment(biography, followers, business);
    }

    private ProfileEnrichment instagram(CandidateCreator candidate, Duration timeout) {
        JsonNode root = get(
            INSTAGRAM_PROFILE_PATH,
            params("userId", candidate.platformUserId()),
            timeout
        ).root();
        String biography = TextSanitizer.clean(text(root, "biography"));
        Long followers = root.has("follower_count") ? number(root, "follower_count") : null;
        return new ProfileEnrichment(biography, followers, flag(root, "is_business_account", "is_business"));
    }

    private ProfileEnrichment youtube(CandidateCreator candidate, Duration timeout) {
        String handle = candidate.hasHandle() ? SeedQueries.normalizeHandle(candidate.handle()) : null;
        JsonNode root = get(
            YOUTUBE_CHANNEL_PATH,
            handle == null
                ? params("channelId", candidate.platformUserId())
                : params("handle", handle),
            timeout
        ).root();
        String description = TextSanitizer.clean(text(root, "description"));
        String email = text(root, "email");
        if (email != null) {
            description = description == null ? email : description + "\n" + email;
        }
        Long subscribers = root.has("subscriberCount") || root.has("subscriberCountText")
            ? number(root, "subscriberCount", "subscriberCountText")
            : null;
        return new ProfileEnrichment(description, subscribers, false);
    }

    private String requireHandle(CandidateCreator candidate) {
        if (!candidate.hasHandle()) {
            throw new PlatformFetchException(FailureKind.ENRICHMENT_FAILURE, "candidate has no handle to enrich");
        }
        return SeedQueries.normalizeHandle(candidate.handle());
    }
}
