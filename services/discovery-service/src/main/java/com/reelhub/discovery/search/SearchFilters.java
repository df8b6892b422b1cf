package com.reelhub.discovery.search;

import com.reelhub.discovery.model.CandidateItem;
import com.reelhub.discovery.model.MediaType;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Structural search filters. Every set filter must pass; genres match when the item carries any
 * of them. A year range with one open end is closed with the earliest year or the current year.
 */
public record SearchFilters(
    MediaType mediaType,
    Integer yearStart,
    Integer yearEnd,
    Double minRating,
    List<Integer> genres
) {
    public SearchFilters {
        genres = genres == null ? List.of() : List.copyOf(genres);
    }

    public static SearchFilters none() {
        return new SearchFilters(null, null, null, null, List.of());
    }

    public boolean isEmpty() {
        return mediaType == null && yearStart == null && yearEnd == null && minRating == null && genres.isEmpty();
    }

    public boolean matches(CandidateItem item, int earliestYear, int currentYear) {
        if (mediaType != null && item.getMediaType() != mediaType) {
            return false;
        }
        if (yearStart != null || yearEnd != null) {
            Integer year = item.releaseYear();
            if (year == null) {
                return false;
            }
            int start = yearStart == null ? earliestYear : yearStart;
            int end = yearEnd == null ? currentYear : yearEnd;
            if (year < start || year > end) {
                return false;
            }
        }
        if (minRating != null) {
            Double rating = item.getVoteAverage();
            if (rating == null || rating < minRating) {
                return false;
            }
        }
        if (!genres.isEmpty()) {
            List<Integer> itemGenres = item.getGenreIds();
            if (itemGenres == null || itemGenres.stream().noneMatch(genres::contains)) {
                return false;
            }
        }
        return true;
    }

    String cacheKeyPart() {
        StringBuilder builder = new StringBuilder();
        if (mediaType != null) {
            builder.append("_mt:").append(mediaType.value());
        }
        if (yearStart != null) {
            builder.append("_ys:").append(yearStart);
        }
        if (yearEnd != null) {
            builder.append("_ye:").append(yearEnd);
        }
        if (minRating != null) {
            builder.append("_mr:").append(minRating);
        }
        if (!genres.isEmpty()) {
            builder.append("_g:").append(
                new TreeSet<>(genres).stream().map(String::valueOf).collect(Collectors.joining(","))
            );
        }
        return builder.toString();
    }
}
