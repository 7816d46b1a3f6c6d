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
import com.delta.creatorscout.discovery.model.SourceContent;
import com.delta.creatorscout.discovery.util.TextSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reels search returns a single ranked page per query, so the cursor walks the keyword list.
 */
@Component
public class InstagramKeywordSearchClient extends ScrapeCreatorsSupport implements PlatformSearchClient {
    private static final String SEARCH_PATH = "/v1/instagram/reels/search";
    private static final int REELS_PER_QUERY = 60;
    private static final Pattern HASHTAG = Pattern.compile("#([\\p{L}\\p{N}_]+)");
    private static final SearchVariant VARIANT = new SearchVariant(Platform.INSTAGRAM, SearchMode.KEYWORD);

    public InstagramKeywordSearchClient(
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
        List<String> keywords = job.keywords();
        if (keywords.isEmpty()) {
            throw new PlatformFetchException(FailureKind.FATAL, "keyword search requires at least one keyword");
        }
        SearchCursor cursor = SearchCursor.decode(objectMapper, rawCursor);
        if (cursor.keywordIndex() >= keywords.size()) {
            return new SearchPage(List.of(), null, false, null);
        }
        SearchCursor next = cursor.keywordIndex() + 1 < keywords.size() ? cursor.nextKeyword() : null;
        try {
            ApiResponse response = get(
                SEARCH_PATH,
                params("query", keywords.get(cursor.keywordIndex()), "amount", REELS_PER_QUERY),
                null
            );
            JsonNode reels = requireArray(response.root(), "reels");
            List<CandidateCreator> candidates = new ArrayList<>();
            for (JsonNode reel : reels) {
                CandidateCreator candidate = toCandidate(reel);
                if (candidate != null) {
                    candidates.add(candidate);
                }
            }
            return new SearchPage(
                candidates,
                next == null ? null : next.encode(objectMapper),
                next != null,
                response.quotaRemainingRatio()
            );
        } catch (MalformedPayloadException e) {
            throw malformed(VARIANT.toString(), e, next);
        }
    }

    static CandidateCreator toCandidate(JsonNode reel) {
        if (reel == null || !reel.isObject()) {
            return null;
        }
        JsonNode owner = reel.path("owner");
        String handle = text(owner, "username");
        String userId = text(owner, "id", "pk");
        if (userId == null) {
            userId = handle;
        }
        if (userId == null) {
            return null;
        }
        String caption = TextSanitizer.clean(text(reel, "caption"));
        String url = text(reel, "url");
        if (url == null && text(reel, "shortcode") != null) {
            url = "https://www.instagram.com/reel/" + text(reel, "shortcode") + "/";
        }
        SourceContent source = new SourceContent(
            text(reel, "id", "shortcode"),
            caption,
            url,
            number(reel, "like_count"),
            number(reel, "comment_count"),
            number(reel, "video_play_count", "video_view_count"),
            0,
            hashtags(caption)
        );
        return new CandidateCreator(
            userId,
            handle,
            TextSanitizer.clean(text(owner, "full_name")),
            flag(owner, "is_verified"),
            flag(owner, "is_private"),
            number(owner, "follower_count"),
            source
        );
    }

    private static List<String> hashtags(String caption) {
        List<String> tags = new ArrayList<>();
        if (caption == null) {
            return tags;
        }
        Matcher matcher = HASHTAG.matcher(caption);
        while (matcher.find()) {
            tags.add(matcher.group(1));
        }
        return tags;
    }
}
