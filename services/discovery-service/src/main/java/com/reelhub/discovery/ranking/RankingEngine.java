package com.reelhub.discovery.ranking;

import com.reelhub.discovery.model.CandidateItem;
import com.reelhub.discovery.model.ItemKey;
import com.reelhub.discovery.model.SourceResult;
import com.reelhub.discovery.model.TasteProfile;
import com.reelhub.discovery.retrieval.RecommendationSource;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Merges tagged source results into one scored, ordered and truncated list.
 *
 * <p>Scores are sums, so the order sources arrive in does not change them. Ties keep the
 * first-seen order of the input.
 */
@Component
public class RankingEngine {
    private final RankingProperties properties;

    public RankingEngine(RankingProperties properties) {
        this.properties = properties;
    }

    public List<CandidateItem> rank(List<SourceResult> sourceResults, RankingContext context) {
        return rankScored(sourceResults, context).stream()
            .map(ScoredCandidate::item)
            .collect(Collectors.toList());
    }

    public List<ScoredCandidate> rankScored(List<SourceResult> sourceResults, RankingContext context) {
        Map<ItemKey, MutableCandidate> candidates = accumulate(sourceResults);

        List<MutableCandidate> eligible = new ArrayList<>(candidates.size());
        for (MutableCandidate candidate : candidates.values()) {
            if (isExcluded(candidate.item, context)) {
                continue;
            }
            candidate.score += boost(candidate.item, context);
            eligible.add(candidate);
        }

        // stable sort
        eligible.sort((a, b) -> Double.compare(b.score, a.score));

        int limit = resolveLimit(context);
        List<MutableCandidate> selected = context.getMode() == RankingMode.HOME_FEED
            ? diversify(eligible, limit)
            : eligible.subList(0, Math.min(limit, eligible.size()));

        List<ScoredCandidate> ranked = new ArrayList<>(selected.size());
        for (MutableCandidate candidate : selected) {
            ranked.add(new ScoredCandidate(candidate.item, candidate.score, candidate.sources));
        }
        return ranked;
    }

    double sourceWeight(String tag) {
        RankingProperties.Weights weights = properties.getWeights();
        RecommendationSource source = RecommendationSource.fromTag(tag);
        if (source == null) {
            return 0.0;
        }
        switch (source) {
            case FRANCHISE:
                return weights.getFranchise();
            case SIMILAR:
            case SIMILAR_RECENT:
            case HISTORY_RECENT:
                return weights.getSimilar();
            case RECOMMENDATIONS:
                return weights.getRecommendations();
            case MY_LIST_INTENT:
                return weights.getMyListIntent();
            case DIRECTOR:
            case PEOPLE_MATCH:
                return weights.getDirector();
            case CAST:
                return weights.getCast();
            case KEYWORD:
            case KEYWORD_MATCH:
                return weights.getKeyword();
            case LANGUAGE_MATCH:
                return weights.getLanguage();
            case STUDIO:
                return weights.getStudio();
            case ERA:
                return weights.getEra();
            case POPULAR_GENRE:
                return weights.getGenre() * weights.getPopularGenreMultiplier();
            case QUALITY_GENRE:
                return weights.getGenre();
            default:
                return 0.0;
        }
    }

    private Map<ItemKey, MutableCandidate> accumulate(List<SourceResult> sourceResults) {
        Map<ItemKey, MutableCandidate> candidates = new LinkedHashMap<>();
        if (sourceResults == null) {
            return candidates;
        }
        double base = properties.getWeights().getBase();
        for (SourceResult result : sourceResults) {
            if (result == null) {
                continue;
            }
            double weight = sourceWeight(result.source());
            for (CandidateItem item : result.items()) {
                if (item == null || item.getMediaType() == null || item.getId() <= 0) {
                    continue;
                }
                MutableCandidate candidate = candidates.computeIfAbsent(item.key(), key -> new MutableCandidate(item));
                // a source listing the same item twice counts once
                if (candidate.sources.contains(result.source())) {
                    continue;
                }
                candidate.sources.add(result.source());
                candidate.score += weight + base;
            }
        }
        return candidates;
    }

    private boolean isExcluded(CandidateItem item, RankingContext context) {
        if (!item.hasImage()) {
            return true;
        }
        ItemKey key = item.key();
        if (key.equals(context.getReferenceKey())) {
            return true;
        }
        return context.getMode() == RankingMode.HOME_FEED && context.getWatchedKeys().contains(key);
    }

    private double boost(CandidateItem item, RankingContext context) {
        RankingProperties.Boosts boosts = properties.getBoosts();
        TasteProfile profile = context.getProfile();
        boolean home = context.getMode() == RankingMode.HOME_FEED;
        double boost = finite(item.getVoteAverage());

        List<Integer> genres = item.getGenreIds();
        if (genres != null && genres.stream().anyMatch(profile.topGenres()::contains)) {
            boost += home ? boosts.getHomeGenre() : boosts.getItemGenre();
        }

        String language = profile.topLanguage();
        if (language != null
            && !language.equalsIgnoreCase(properties.getPlatformLanguage())
            && language.equalsIgnoreCase(item.getOriginalLanguage())) {
            boost += boosts.getLanguage();
        }

        if (profile.topEra() != null && Objects.equals(profile.topEra(), item.releaseDecade())) {
            boost += boosts.getEra();
        }

        if (context.getListKeys().contains(item.key())) {
            SavedListPolicy policy = context.getSavedListPolicy() != null
                ? context.getSavedListPolicy()
                : home ? properties.getHomeSavedListPolicy() : properties.getItemSavedListPolicy();
            if (policy == SavedListPolicy.BOOST) {
                boost += boosts.getSavedListBoost();
            } else if (policy == SavedListPolicy.PENALTY) {
                boost -= boosts.getSavedListPenalty();
            }
        }
        return boost;
    }

    /**
     * Greedy pass capping items per primary genre; outliers bypass the cap but still count toward
     * it. Skipped items backfill the tail when the pass comes up short.
     */
    private List<MutableCandidate> diversify(List<MutableCandidate> sorted, int limit) {
        List<MutableCandidate> selected = new ArrayList<>(limit);
        List<MutableCandidate> skipped = new ArrayList<>();
        Map<Integer, Integer> genreCounts = new HashMap<>();

        for (MutableCandidate candidate : sorted) {
            if (selected.size() >= limit) {
                break;
            }
            Integer genre = candidate.item.primaryGenre();
            if (genre == null) {
                selected.add(candidate);
                continue;
            }
            int count = genreCounts.getOrDefault(genre, 0);
            if (count < properties.getGenreCap() || candidate.score > properties.getOutlierThreshold()) {
                selected.add(candidate);
                genreCounts.put(genre, count + 1);
            } else {
                skipped.add(candidate);
            }
        }

        for (MutableCandidate candidate : skipped) {
            if (selected.size() >= limit) {
                break;
            }
            selected.add(candidate);
        }
        return selected;
    }

    private int resolveLimit(RankingContext context) {
        if (context.getLimit() != null && context.getLimit() > 0) {
            return context.getLimit();
        }
        return context.getMode() == RankingMode.HOME_FEED ? properties.getHomeLimit() : properties.getItemLimit();
    }

    private static double finite(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return 0.0;
        }
        return value;
    }

    private static final class MutableCandidate {
        private final CandidateItem item;
        private final List<String> sources = new ArrayList<>();
        private double score;

        private MutableCandidate(CandidateItem item) {
            this.item = item;
        }
    }
}
