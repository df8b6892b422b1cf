package com.reelhub.discovery.model;

import java.util.List;

/**
 * Per-request summary of inferred preferences. Never cached or persisted.
 */
public record TasteProfile(
    List<Integer> topGenres,
    List<Long> topPeople,
    String topLanguage,
    List<Long> topKeywords,
    Integer topEra
) {
    private static final TasteProfile EMPTY = new TasteProfile(List.of(), List.of(), null, List.of(), null);

    public TasteProfile {
        topGenres = topGenres == null ? List.of() : List.copyOf(topGenres);
        topPeople = topPeople == null ? List.of() : List.copyOf(topPeople);
        topKeywords = topKeywords == null ? List.of() : List.copyOf(topKeywords);
    }

    public static TasteProfile empty() {
        return EMPTY;
    }

    public static TasteProfile genresOnly(List<Integer> topGenres) {
        return new TasteProfile(topGenres, List.of(), null, List.of(), null);
    }

    public boolean isEmpty() {
        return topGenres.isEmpty() && topPeople.isEmpty() && topLanguage == null
            && topKeywords.isEmpty() && topEra == null;
    }
}
