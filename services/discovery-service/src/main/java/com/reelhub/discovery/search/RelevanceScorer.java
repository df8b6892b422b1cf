package com.reelhub.discovery.search;

import com.reelhub.discovery.cache.CacheKeyUtil;
import com.reelhub.discovery.model.CandidateItem;
import com.reelhub.discovery.model.MediaType;
import java.time.Clock;
import java.time.Year;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Scores a search hit against the query. Title match quality dominates (exact 100, prefix 80,
 * substring 60, otherwise fuzzy plus token overlap); popularity, rating, vote count, recency and
 * media type add bounded bonuses. Scores are rounded to two decimals.
 */
@Component
public class RelevanceScorer {
    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    private final SearchProperties properties;
    private final Clock clock;

    @Autowired
    public RelevanceScorer(SearchProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public RelevanceScorer(SearchProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public double score(CandidateItem item, String query) {
        String normalizedQuery = CacheKeyUtil.normalizeQuery(query);
        String title = normalizeTitle(item.getTitle());
        String originalTitle = normalizeTitle(item.getOriginalTitle());
        double score = 0.0;

        if (!normalizedQuery.isEmpty() && (title.equals(normalizedQuery) || originalTitle.equals(normalizedQuery))) {
            score += 100;
        } else if (!normalizedQuery.isEmpty()
            && (title.startsWith(normalizedQuery) || originalTitle.startsWith(normalizedQuery))) {
            score += 80;
        } else if (!normalizedQuery.isEmpty()
            && (title.contains(normalizedQuery) || originalTitle.contains(normalizedQuery))) {
            score += 60;
        } else {
            double best = Math.max(similarity(title, normalizedQuery), similarity(originalTitle, normalizedQuery));
            if (best > properties.getFuzzyThreshold()) {
                score += best * 50;
            }
            List<String> tokens = tokenize(normalizedQuery);
            long matches = tokens.stream()
                .filter(token -> title.contains(token) || originalTitle.contains(token))
                .count();
            score += ((double) matches / Math.max(tokens.size(), 1)) * 30;
        }

        Double popularity = item.getPopularity();
        if (popularity != null && popularity > 0) {
            score += Math.min(popularity / 500.0 * 20, 20);
        }
        Double voteAverage = item.getVoteAverage();
        if (voteAverage != null && voteAverage > 0) {
            score += voteAverage / 10.0 * 15;
        }
        Integer voteCount = item.getVoteCount();
        if (voteCount != null && voteCount > 0) {
            score += Math.min(voteCount / 1000.0 * 10, 10);
        }
        score += recencyBonus(item.releaseYear());
        if (item.getMediaType() == MediaType.MOVIE) {
            score += 2;
        }
        if (Double.isNaN(score) || Double.isInfinite(score)) {
            return 0.0;
        }
        return Math.round(score * 100) / 100.0;
    }

    /**
     * Case-insensitive Levenshtein similarity in [0, 1].
     */
    public static double similarity(String left, String right) {
        if (left == null || right == null || left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        String a = left.trim().toLowerCase(Locale.ROOT);
        String b = right.trim().toLowerCase(Locale.ROOT);
        if (a.equals(b)) {
            return 1.0;
        }
        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 0.0;
        }
        return 1.0 - ((double) LEVENSHTEIN.apply(a, b) / maxLength);
    }

    public int currentYear() {
        return Year.now(clock).getValue();
    }

    private double recencyBonus(Integer year) {
        if (year == null) {
            return 0;
        }
        int age = currentYear() - year;
        if (age <= 1) {
            return 10;
        }
        if (age <= 3) {
            return 7;
        }
        if (age <= 5) {
            return 4;
        }
        return 0;
    }

    private static String normalizeTitle(String title) {
        return title == null ? "" : title.trim().toLowerCase(Locale.ROOT);
    }

    private static List<String> tokenize(String normalizedQuery) {
        if (normalizedQuery.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(normalizedQuery.split("\\s+"))
            .filter(token -> !token.isEmpty())
            .collect(Collectors.toList());
    }
}
