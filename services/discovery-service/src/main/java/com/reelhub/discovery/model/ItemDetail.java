package com.reelhub.discovery.model;

import java.util.List;

/**
 * Expanded provider detail for one item (credits and keywords appended). Only the fields the
 * taste extraction and item-based retrieval read are kept.
 */
public record ItemDetail(
    ItemKey key,
    String originalLanguage,
    String releaseDate,
    List<Integer> genreIds,
    List<Long> directorIds,
    List<Long> castIds,
    List<Long> keywordIds,
    List<Long> companyIds,
    Long collectionId
) {
    public ItemDetail {
        genreIds = genreIds == null ? List.of() : List.copyOf(genreIds);
        directorIds = directorIds == null ? List.of() : List.copyOf(directorIds);
        castIds = castIds == null ? List.of() : List.copyOf(castIds);
        keywordIds = keywordIds == null ? List.of() : List.copyOf(keywordIds);
        companyIds = companyIds == null ? List.of() : List.copyOf(companyIds);
    }

    public Integer releaseDecade() {
        return ReleaseDates.decade(releaseDate);
    }
}
