package com.reelhub.discovery.retrieval;

import java.util.Locale;

/**
 * Known retrieval sources. Numbered sources are emitted as {@code tag_<n>}, one per seed item.
 */
public enum RecommendationSource {
    FRANCHISE("franchise", false, true),
    SIMILAR("similar", false, true),
    RECOMMENDATIONS("recommendations", false, true),
    SIMILAR_RECENT("similar_recent", false, true),
    HISTORY_RECENT("history_recent", true, true),
    MY_LIST_INTENT("mylist_intent", true, true),
    POPULAR_GENRE("popular_genre", true, true),
    QUALITY_GENRE("quality_genre", true, true),
    DIRECTOR("director", false, false),
    PEOPLE_MATCH("people_match", false, false),
    CAST("cast", false, false),
    KEYWORD("keyword", false, false),
    KEYWORD_MATCH("keyword_match", false, false),
    LANGUAGE_MATCH("language_match", false, false),
    STUDIO("studio", false, false),
    ERA("era", false, false);

    private final String tag;
    private final boolean numbered;
    private final boolean primary;

    RecommendationSource(String tag, boolean numbered, boolean primary) {
        this.tag = tag;
        this.numbered = numbered;
        this.primary = primary;
    }

    public String tag() {
        return tag;
    }

    public String tag(int index) {
        return numbered ? tag + "_" + index : tag;
    }

    /**
     * Primary sources are awaited; the rest race the secondary deadline.
     */
    public boolean isPrimary() {
        return primary;
    }

    public static RecommendationSource fromTag(String tag) {
        if (tag == null) {
            return null;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (RecommendationSource source : values()) {
            if (source.numbered) {
                if (normalized.startsWith(source.tag + "_") && isDigits(normalized.substring(source.tag.length() + 1))) {
                    return source;
                }
            } else if (normalized.equals(source.tag)) {
                return source;
            }
        }
        return null;
    }

    private static boolean isDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
