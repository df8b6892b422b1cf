package com.reelhub.discovery.retrieval;

import com.reelhub.discovery.model.CandidateItem;
import com.reelhub.discovery.model.ItemDetail;
import com.reelhub.discovery.model.ItemKey;
import com.reelhub.discovery.model.MediaType;
import com.reelhub.discovery.model.SourceResult;
import com.reelhub.discovery.model.TasteProfile;
import com.reelhub.discovery.model.WatchHistoryItem;
import com.reelhub.discovery.profile.TasteAnalysis;
import com.reelhub.discovery.upstream.MetadataGateway;
import com.reelhub.discovery.upstream.TmdbClient;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Issues the tagged discovery queries for a home feed or a reference item concurrently.
 *
 * <p>All sources are dispatched before any is awaited. Primary sources are awaited in full;
 * secondary sources share one deadline measured from dispatch and resolve to an empty result when
 * they miss it. The late call is not aborted. A failing source is dropped without affecting the
 * others.
 */
@Component
public class RetrievalOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(RetrievalOrchestrator.class);

    private final MetadataGateway gateway;
    private final RetrievalProperties properties;

    public RetrievalOrchestrator(MetadataGateway gateway, RetrievalProperties properties) {
        this.gateway = gateway;
        this.properties = properties;
    }

    /**
     * Sources for a reference item when one is given, otherwise the profile-driven sources.
     */
    public List<SourceResult> retrieve(TasteProfile profile, ItemDetail reference) {
        List<PendingSource> pending = new ArrayList<>();
        if (reference != null) {
            addItemSources(pending, reference);
        } else {
            addProfileSources(pending, profile == null ? TasteProfile.empty() : profile);
        }
        return settle(pending);
    }

    /**
     * Home feed sources: profile-driven discovery plus per-item recommendations for recent history
     * and saved-list entries, and the franchise of the most recent item that belongs to one.
     */
    public List<SourceResult> retrieveHome(
        TasteAnalysis analysis,
        List<? extends WatchHistoryItem> watchHistory,
        List<? extends WatchHistoryItem> listItems
    ) {
        TasteAnalysis resolved = analysis == null ? TasteAnalysis.empty() : analysis;
        List<PendingSource> pending = new ArrayList<>();

        List<ItemKey> recent = recentKeys(watchHistory, properties.getRecentItems());
        for (int i = 0; i < recent.size(); i++) {
            ItemKey key = recent.get(i);
            dispatch(pending, RecommendationSource.HISTORY_RECENT.tag(i), () -> gateway.recommendations(key));
        }
        if (!recent.isEmpty()) {
            ItemKey newest = recent.get(0);
            dispatch(pending, RecommendationSource.SIMILAR_RECENT.tag(), () -> gateway.similar(newest));
        }

        List<ItemKey> saved = recentKeys(listItems, properties.getListItems());
        saved.removeAll(recent);
        for (int i = 0; i < saved.size(); i++) {
            ItemKey key = saved.get(i);
            dispatch(pending, RecommendationSource.MY_LIST_INTENT.tag(i), () -> gateway.recommendations(key));
        }

        resolved.details().stream()
            .filter(detail -> detail.collectionId() != null)
            .findFirst()
            .ifPresent(detail -> dispatch(
                pending,
                RecommendationSource.FRANCHISE.tag(),
                () -> gateway.collectionParts(detail.collectionId())
            ));

        addProfileSources(pending, resolved.profile());
        return settle(pending);
    }

    private void addProfileSources(List<PendingSource> pending, TasteProfile profile) {
        List<Integer> genres = profile.topGenres();
        if (!genres.isEmpty()) {
            Map<String, Object> popular = new LinkedHashMap<>();
            popular.put("with_genres", genres.get(0));
            popular.put("sort_by", "popularity.desc");
            popular.put("vote_count.gte", properties.getPopularVoteFloor());
            dispatch(pending, RecommendationSource.POPULAR_GENRE.tag(1),
                () -> gateway.discover(MediaType.MOVIE, popular));

            Map<String, Object> quality = new LinkedHashMap<>();
            quality.put("with_genres", genres.size() > 1 ? genres.get(1) : genres.get(0));
            quality.put("sort_by", "vote_average.desc");
            quality.put("vote_count.gte", properties.getQualityVoteFloor());
            dispatch(pending, RecommendationSource.QUALITY_GENRE.tag(2),
                () -> gateway.discover(MediaType.MOVIE, quality));
        }

        if (!profile.topPeople().isEmpty()) {
            Map<String, Object> people = new LinkedHashMap<>();
            people.put("with_people", profile.topPeople().get(0));
            people.put("sort_by", "popularity.desc");
            dispatch(pending, RecommendationSource.PEOPLE_MATCH.tag(),
                () -> gateway.discover(MediaType.MOVIE, people));
        }

        if (profile.topLanguage() != null) {
            Map<String, Object> language = new LinkedHashMap<>();
            language.put("with_original_language", profile.topLanguage());
            language.put("sort_by", "popularity.desc");
            language.put("vote_count.gte", properties.getPopularVoteFloor());
            dispatch(pending, RecommendationSource.LANGUAGE_MATCH.tag(),
                () -> gateway.discover(MediaType.MOVIE, language));
        }

        if (!profile.topKeywords().isEmpty()) {
            Map<String, Object> keywords = new LinkedHashMap<>();
            keywords.put("with_keywords", join(profile.topKeywords(), properties.getKeywordLimit(), "|"));
            keywords.put("sort_by", "popularity.desc");
            dispatch(pending, RecommendationSource.KEYWORD_MATCH.tag(),
                () -> gateway.discover(MediaType.MOVIE, keywords));
        }

        if (profile.topEra() != null && !genres.isEmpty()) {
            Map<String, Object> era = eraParams(MediaType.MOVIE, profile.topEra(), genres);
            dispatch(pending, RecommendationSource.ERA.tag(), () -> gateway.discover(MediaType.MOVIE, era));
        }
    }

    private void addItemSources(List<PendingSource> pending, ItemDetail reference) {
        ItemKey key = reference.key();
        MediaType type = key.mediaType();

        dispatch(pending, RecommendationSource.SIMILAR.tag(), () -> gateway.similar(key));
        dispatch(pending, RecommendationSource.RECOMMENDATIONS.tag(), () -> gateway.recommendations(key));
        if (type == MediaType.MOVIE && reference.collectionId() != null) {
            dispatch(pending, RecommendationSource.FRANCHISE.tag(),
                () -> gateway.collectionParts(reference.collectionId()));
        }

        if (type == MediaType.MOVIE && !reference.directorIds().isEmpty()) {
            Map<String, Object> director = new LinkedHashMap<>();
            director.put("with_people", reference.directorIds().get(0));
            director.put("sort_by", "popularity.desc");
            dispatch(pending, RecommendationSource.DIRECTOR.tag(),
                () -> gateway.discover(MediaType.MOVIE, director));
        }

        if (!reference.keywordIds().isEmpty()) {
            Map<String, Object> keywords = new LinkedHashMap<>();
            keywords.put("with_keywords", join(reference.keywordIds(), properties.getKeywordLimit(), "|"));
            keywords.put("sort_by", "popularity.desc");
            dispatch(pending, RecommendationSource.KEYWORD.tag(), () -> gateway.discover(type, keywords));
        }

        Integer decade = reference.releaseDecade();
        if (decade != null && !reference.genreIds().isEmpty()) {
            Map<String, Object> era = eraParams(type, decade, reference.genreIds());
            dispatch(pending, RecommendationSource.ERA.tag(), () -> gateway.discover(type, era));
        }

        if (type == MediaType.MOVIE && !reference.castIds().isEmpty()) {
            Map<String, Object> cast = new LinkedHashMap<>();
            cast.put("with_cast", join(reference.castIds(), properties.getCastLimit(), ","));
            cast.put("sort_by", "popularity.desc");
            dispatch(pending, RecommendationSource.CAST.tag(), () -> gateway.discover(MediaType.MOVIE, cast));
        }

        if (!reference.companyIds().isEmpty()) {
            Map<String, Object> studio = new LinkedHashMap<>();
            studio.put("with_companies", reference.companyIds().get(0));
            studio.put("sort_by", "popularity.desc");
            dispatch(pending, RecommendationSource.STUDIO.tag(), () -> gateway.discover(type, studio));
        }
    }

    private Map<String, Object> eraParams(MediaType type, int decade, List<Integer> genres) {
        String dateField = type == MediaType.TV ? "first_air_date" : "primary_release_date";
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("with_genres", join(genres, properties.getEraGenreLimit(), ","));
        params.put(dateField + ".gte", decade + "-01-01");
        params.put(dateField + ".lte", (decade + 9) + "-12-31");
        params.put("sort_by", "vote_average.desc");
        params.put("vote_count.gte", properties.getEraVoteFloor());
        return params;
    }

    private void dispatch(
        List<PendingSource> pending,
        String tag,
        Supplier<CompletableFuture<List<CandidateItem>>> call
    ) {
        RecommendationSource source = RecommendationSource.fromTag(tag);
        boolean primary = source == null || source.isPrimary();
        CompletableFuture<List<CandidateItem>> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        pending.add(new PendingSource(tag, primary, future));
    }

    private List<SourceResult> settle(List<PendingSource> pending) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, properties.getSecondaryTimeoutMs()));
        List<SourceResult> results = new ArrayList<>();
        for (PendingSource source : pending) {
            SourceResult result = await(source, deadline);
            if (result != null) {
                results.add(result);
            }
        }
        return results;
    }

    private SourceResult await(PendingSource source, long deadlineNanos) {
        try {
            List<CandidateItem> items;
            if (source.primary) {
                items = source.future.get();
            } else {
                long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
                items = source.future.get(remaining, TimeUnit.NANOSECONDS);
            }
            return new SourceResult(source.tag, items);
        } catch (TimeoutException e) {
            logger.debug("source_timeout source={}", source.tag);
            return SourceResult.empty(source.tag);
        } catch (ExecutionException e) {
            logger.warn("source_failed source={} reason={}", source.tag, TmdbClient.unwrap(e).getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("source_interrupted source={}", source.tag);
            return null;
        }
    }

    private static List<ItemKey> recentKeys(List<? extends WatchHistoryItem> items, int limit) {
        Set<ItemKey> keys = new LinkedHashSet<>();
        if (items == null) {
            return new ArrayList<>();
        }
        for (WatchHistoryItem item : items) {
            if (keys.size() >= limit) {
                break;
            }
            if (item != null && item.getId() > 0) {
                keys.add(item.key());
            }
        }
        return new ArrayList<>(keys);
    }

    private static String join(List<?> values, int limit, String delimiter) {
        return values.stream()
            .limit(Math.max(1, limit))
            .map(String::valueOf)
            .collect(Collectors.joining(delimiter));
    }

    private static final class PendingSource {
        private final String tag;
        private final boolean primary;
        private final CompletableFuture<List<CandidateItem>> future;

        private PendingSource(String tag, boolean primary, CompletableFuture<List<CandidateItem>> future) {
            this.tag = tag;
            this.primary = primary;
            this.future = future;
        }
    }
}
