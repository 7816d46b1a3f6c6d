package com.delta.creatorscout.discovery.model;

import java.util.Locale;

public enum Platform {
    TIKTOK,
    INSTAGRAM,
    YOUTUBE;

    public static Platform fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (Platform platform : values()) {
            if (platform.name().equals(normalized)) {
                return platform;
            }
        }
        return null;
    }
}
