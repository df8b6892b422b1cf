package com.reelhub.discovery.search;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SearchSort {
    RELEVANCE("relevance"),
    RECENT("recent"),
    POPULAR("popular"),
    RATING("rating");

    private final String value;

    SearchSort(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Unknown or missing keys sort by relevance.
     */
    public static SearchSort fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return RELEVANCE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SearchSort sort : values()) {
            if (sort.value.equals(normalized)) {
                return sort;
            }
        }
        return RELEVANCE;
    }
}
