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

@Component
public class TikTokKeywordSearchClient extends ScrapeCreatorsSupport implements PlatformSearchClient {
    private static final String SEARCH_PATH = "/v1/tiktok/search/keyword";
    private static final SearchVariant VARIANT = new SearchVariant(Platform.TIKTOK, SearchMode.KEYWORD);

    public TikTokKeywordSearchClient(
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
        SearchCursor nextKeyword = cursor.keywordIndex() + 1 < keywords.size() ? cursor.nextKeyword() : null;
        String keyword = keywords.get(cursor.keywordIndex());
        try {
            ApiResponse response = get(
                SEARCH_PATH,
                params("query", keyword, "cursor", cursor.offset(), "region", regionOf(job)),
                null
            );
            JsonNode items = requireArray(response.root(), "search_item_list");
            List<CandidateCreator> candidates = new ArrayList<>();
            for (JsonNode item : items) {
                CandidateCreator candidate = toCandidate(item.path("aweme_info"));
                if (candidate != null) {
                    candidates.add(candidate);
                }
            }
            boolean keywordHasMore = flag(response.root(), "has_more");
            SearchCursor next;
            if (keywordHasMore && !items.isEmpty()) {
                long apiCursor = number(response.root(), "cursor");
                next = cursor.withOffset(apiCursor > cursor.offset() ? apiCursor : cursor.offset() + items.size());
            } else {
                next = nextKeyword;
            }
            return new SearchPage(
                candidates,
                next == null ? null : next.encode(objectMapper),
                next != null,
                response.quotaRemainingRatio()
            );
        } catch (MalformedPayloadException e) {
            throw malformed(VARIANT.toString(), e, nextKeyword);
        }
    }

    static CandidateCreator toCandidate(JsonNode aweme) {
        if (aweme == null || aweme.isMissingNode() || !aweme.isObject()) {
            return null;
        }
        JsonNode author = aweme.path("author");
        String userId = text(author, "uid", "id", "sec_uid");
        String handle = text(author, "unique_id");
        if (userId == null) {
            userId = handle;
        }
        if (userId == null) {
            return null;
        }
        JsonNode statistics = aweme.path("statistics");
        List<String> hashtags = new ArrayList<>();
        for (JsonNode extra : aweme.path("text_extra")) {
            if (extra.path("type").asInt(-1) == 1) {
                String tag = text(extra, "hashtag_name");
                if (tag != null) {
                    hashtags.add(tag);
                }
            }
        }
        SourceContent source = new SourceContent(
            text(aweme, "aweme_id", "id"),
            TextSanitizer.clean(text(aweme, "desc")),
            text(aweme, "share_url"),
            number(statistics, "digg_count"),
            number(statistics, "comment_count"),
            number(statistics, "play_count"),
            number(statistics, "share_count"),
            hashtags
        );
        return new CandidateCreator(
            userId,
            handle,
            TextSanitizer.clean(text(author, "nickname")),
            flag(author, "is_verified", "verified") || number(author, "verification_type") > 0,
            flag(author, "secret", "is_private_account", "private_account"),
            number(author, "follower_count"),
            source
        );
    }
}
