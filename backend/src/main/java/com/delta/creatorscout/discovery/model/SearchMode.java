package com.delta.creatorscout.discovery.model;

import java.util.Locale;

public enum SearchMode {
    KEYWORD,
    SIMILAR_TO_SEED;

    public static SearchMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("SIMILAR")) {
            return SIMILAR_TO_SEED;
        }
        for (SearchMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        return null;
    }
}
