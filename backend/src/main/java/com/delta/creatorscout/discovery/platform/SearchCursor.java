package com.delta.creatorscout.discovery.platform;

import com.delta.creatorscout.discovery.model.FailureKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchCursor(int keywordIndex, long offset, String token, List<String> queries) {

    static SearchCursor start() {
        return new SearchCursor(0, 0, null, null);
    }

    SearchCursor withOffset(long nextOffset) {
        return new SearchCursor(keywordIndex, nextOffset, null, queries);
    }

    SearchCursor withToken(String nextToken) {
        return new SearchCursor(keywordIndex, 0, nextToken, queries);
    }

    SearchCursor nextKeyword() {
        return new SearchCursor(keywordIndex + 1, 0, null, queries);
    }

    SearchCursor withQueries(List<String> derived) {
        return new SearchCursor(0, 0, null, derived);
    }

    static SearchCursor decode(ObjectMapper objectMapper, String raw) {
        if (raw == null || raw.isBlank()) {
            return start();
        }
        try {
            return objectMapper.readValue(raw, SearchCursor.class);
        } catch (JsonProcessingException e) {
            throw new PlatformFetchException(FailureKind.FATAL, "unreadable resume cursor", e);
        }
    }

    String encode(ObjectMapper objectMapper) {
        try {
            return objectMapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode search cursor", e);
        }
    }
}
