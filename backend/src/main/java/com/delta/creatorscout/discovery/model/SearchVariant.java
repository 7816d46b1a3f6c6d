package com.delta.creatorscout.discovery.model;

import java.util.Locale;

public record SearchVariant(Platform platform, SearchMode mode) {
    public SearchVariant {
        if (platform == null || mode == null) {
            throw new IllegalArgumentException("platform and mode are required");
        }
    }

    @Override
    public String toString() {
        return platform.name().toLowerCase(Locale.ROOT) + ":" + mode.name().toLowerCase(Locale.ROOT);
    }
}
