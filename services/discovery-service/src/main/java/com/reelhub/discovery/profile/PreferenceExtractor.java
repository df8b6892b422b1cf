package com.reelhub.discovery.profile;

import com.reelhub.discovery.model.ItemDetail;
import com.reelhub.discovery.model.ItemKey;
import com.reelhub.discovery.model.TasteProfile;
import com.reelhub.discovery.model.WatchHistoryItem;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives a weighted taste profile from a newest-first watch history and saved list.
 *
 * <p>Genres come from the whole history with a per-position decay. People, language, keywords
 * and era come from the expanded details of the most recent history and list entries, with a
 * steeper decay and directors counted several times over cast.
 */
@Component
public class PreferenceExtractor {
    private static final Logger logger = LoggerFactory.getLogger(PreferenceExtractor.class);
    private static final int TOP_GENRES = 3;
    private static final int TOP_PEOPLE = 2;
    private static final int TOP_KEYWORDS = 3;

    private final PreferenceProperties properties;

    public PreferenceExtractor(PreferenceProperties properties) {
        this.properties = properties;
    }

    public TasteProfile extract(
        List<? extends WatchHistoryItem> watchHistory,
        List<? extends WatchHistoryItem> listItems,
        DetailFetcher detailFetcher
    ) {
        return analyze(watchHistory, listItems, detailFetcher).profile();
    }

    public TasteAnalysis analyze(
        List<? extends WatchHistoryItem> watchHistory,
        List<? extends WatchHistoryItem> listItems,
        DetailFetcher detailFetcher
    ) {
        List<? extends WatchHistoryItem> history = watchHistory == null ? List.of() : watchHistory;
        List<? extends WatchHistoryItem> saved = listItems == null ? List.of() : listItems;
        if (history.isEmpty() && saved.isEmpty()) {
            return TasteAnalysis.empty();
        }

        List<Integer> topGenres = topGenres(history);
        List<ItemDetail> details = fetchDetails(signalKeys(history, saved), detailFetcher);

        Map<Long, Double> people = new LinkedHashMap<>();
        Map<String, Double> languages = new LinkedHashMap<>();
        Map<Long, Double> keywords = new LinkedHashMap<>();
        Map<Integer, Double> eras = new LinkedHashMap<>();

        for (int position = 0; position < details.size(); position++) {
            ItemDetail detail = details.get(position);
            double weight = Math.pow(properties.getDetailDecay(), position);

            if (detail.originalLanguage() != null) {
                languages.merge(detail.originalLanguage(), weight, Double::sum);
            }
            for (Long director : detail.directorIds()) {
                people.merge(director, weight * properties.getDirectorWeight(), Double::sum);
            }
            int castLimit = Math.min(properties.getCastPerItem(), detail.castIds().size());
            for (Long cast : detail.castIds().subList(0, castLimit)) {
                people.merge(cast, weight, Double::sum);
            }
            for (Long keyword : detail.keywordIds()) {
                keywords.merge(keyword, weight, Double::sum);
            }
            Integer decade = detail.releaseDecade();
            if (decade != null) {
                eras.merge(decade, weight, Double::sum);
            }
        }

        String topLanguage = first(top(languages, 1));
        if (topLanguage != null && topLanguage.equalsIgnoreCase(properties.getPlatformLanguage())) {
            topLanguage = null;
        }

        TasteProfile profile = new TasteProfile(
            topGenres,
            top(people, TOP_PEOPLE),
            topLanguage,
            top(keywords, TOP_KEYWORDS),
            first(top(eras, 1))
        );
        return new TasteAnalysis(profile, details);
    }

    /**
     * Top genre ids by decayed frequency; index 0 of the history weighs 1.0.
     */
    public List<Integer> topGenres(List<? extends WatchHistoryItem> watchHistory) {
        if (watchHistory == null || watchHistory.isEmpty()) {
            return List.of();
        }
        Map<Integer, Double> scores = new LinkedHashMap<>();
        for (int index = 0; index < watchHistory.size(); index++) {
            WatchHistoryItem item = watchHistory.get(index);
            if (item == null || item.getGenreIds() == null) {
                continue;
            }
            double weight = Math.pow(properties.getGenreDecay(), index);
            for (Integer genreId : item.getGenreIds()) {
                if (genreId != null) {
                    scores.merge(genreId, weight, Double::sum);
                }
            }
        }
        return top(scores, TOP_GENRES);
    }

    private List<ItemKey> signalKeys(List<? extends WatchHistoryItem> history, List<? extends WatchHistoryItem> saved) {
        Set<ItemKey> keys = new LinkedHashSet<>();
        addRecent(keys, history, properties.getRecentItems());
        addRecent(keys, saved, properties.getListItems());
        return new ArrayList<>(keys);
    }

    private static void addRecent(Set<ItemKey> keys, List<? extends WatchHistoryItem> items, int limit) {
        int added = 0;
        for (WatchHistoryItem item : items) {
            if (added >= limit) {
                break;
            }
            if (item == null || item.getId() <= 0) {
                continue;
            }
            keys.add(item.key());
            added++;
        }
    }

    private List<ItemDetail> fetchDetails(List<ItemKey> keys, DetailFetcher detailFetcher) {
        if (keys.isEmpty() || detailFetcher == null) {
            return List.of();
        }
        List<CompletableFuture<ItemDetail>> futures = new ArrayList<>();
        for (ItemKey key : keys) {
            futures.add(safeFetch(key, detailFetcher));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ItemDetail> details = new ArrayList<>();
        for (CompletableFuture<ItemDetail> future : futures) {
            ItemDetail detail = future.join();
            if (detail != null) {
                details.add(detail);
            }
        }
        return details;
    }

    private static CompletableFuture<ItemDetail> safeFetch(ItemKey key, DetailFetcher detailFetcher) {
        CompletableFuture<ItemDetail> future;
        try {
            future = detailFetcher.fetch(key);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            return CompletableFuture.completedFuture(null);
        }
        return future.exceptionally(error -> {
            logger.warn("taste_detail_fetch_failed item={} reason={}", key, error.getMessage());
            return null;
        });
    }

    private static <K> List<K> top(Map<K, Double> scores, int limit) {
        // List.sort is stable: ties keep first-seen order
        List<Map.Entry<K, Double>> entries = new ArrayList<>(scores.entrySet());
        entries.sort((a, b) -> Double.compare(b.getValue(), a.getValue()));
        return entries.stream()
            .limit(limit)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    private static <K> K first(List<K> values) {
        return values.isEmpty() ? null : values.get(0);
    }
}
