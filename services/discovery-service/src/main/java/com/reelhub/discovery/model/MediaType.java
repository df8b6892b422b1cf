package com.reelhub.discovery.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MediaType {
    MOVIE("movie"),
    TV("tv");

    private final String value;

    MediaType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves a provider or client media type. Accepts {@code series} as an alias of {@code tv}.
     * Returns null for anything else, including {@code person}.
     */
    @JsonCreator
    public static MediaType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "movie":
                return MOVIE;
            case "tv":
            case "series":
                return TV;
            default:
                return null;
        }
    }
}
