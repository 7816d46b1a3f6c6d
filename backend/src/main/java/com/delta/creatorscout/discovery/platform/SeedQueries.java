package com.delta.creatorscout.discovery.platform;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SeedQueries {
    static final int MAX_QUERIES = 3;
    private static final Pattern HASHTAG = Pattern.compile("#([\\p{L}\\p{N}_]{3,})");
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]{4,}");
    private static final Set<String> STOP_WORDS = Set.of(
        "official", "channel", "account", "youtube", "tiktok", "instagram", "follow", "subscribe", "email",
        "contact", "business", "inquiries", "with", "from", "your", "this", "that", "about", "here"
    );

    private SeedQueries() {}

    static List<String> derive(String seedHandle, String displayName, String biography) {
        Set<String> queries = new LinkedHashSet<>();
        if (biography != null) {
            Matcher hashtags = HASHTAG.matcher(biography);
            while (hashtags.find() && queries.size() < MAX_QUERIES) {
                queries.add(hashtags.group(1).toLowerCase(Locale.ROOT));
            }
            if (queries.size() < MAX_QUERIES) {
                addWords(queries, biography.replaceAll("\\S+@\\S+", " "));
            }
        }
        if (queries.size() < MAX_QUERIES && displayName != null) {
            addWords(queries, displayName);
        }
        if (queries.isEmpty() && seedHandle != null && !seedHandle.isBlank()) {
            queries.add(normalizeHandle(seedHandle));
        }
        return new ArrayList<>(queries);
    }

    public static String normalizeHandle(String handle) {
        if (handle == null) {
            return null;
        }
        String value = handle.trim();
        while (value.startsWith("@")) {
            value = value.substring(1);
        }
        return value;
    }

    private static void addWords(Set<String> queries, String text) {
        Matcher words = WORD.matcher(text);
        while (words.find() && queries.size() < MAX_QUERIES) {
            String word = words.group().toLowerCase(Locale.ROOT);
            if (!STOP_WORDS.contains(word)) {
                queries.add(word);
            }
        }
    }
}
