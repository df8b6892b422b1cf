package com.reelhub.discovery.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelhub.discovery.api.dto.RecommendationResponse;
import com.reelhub.discovery.cache.CacheKeyUtil;
import com.reelhub.discovery.cache.CacheResult;
import com.reelhub.discovery.cache.ComputeCache;
import com.reelhub.discovery.cache.DiscoveryCacheProperties;
import com.reelhub.discovery.model.CandidateItem;
import com.reelhub.discovery.model.ItemDetail;
import com.reelhub.discovery.model.ItemKey;
import com.reelhub.discovery.model.SourceResult;
import com.reelhub.discovery.model.TasteProfile;
import com.reelhub.discovery.model.WatchHistoryItem;
import com.reelhub.discovery.profile.PreferenceExtractor;
import com.reelhub.discovery.profile.TasteAnalysis;
import com.reelhub.discovery.ranking.RankingContext;
import com.reelhub.discovery.ranking.RankingEngine;
import com.reelhub.discovery.retrieval.RetrievalOrchestrator;
import com.reelhub.discovery.upstream.MetadataGateway;
import com.reelhub.discovery.upstream.UpstreamFutures;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Request-level recommendation flows: home feed, item detail and the trending listing they fall
 * back to. Every flow is served through the compute cache.
 */
@Service
public class RecommendationService {
    private static final Logger logger = LoggerFactory.getLogger(RecommendationService.class);
    static final String TRENDING_KEY = "trending_all_week";
    static final String USER_PREFIX = "recs_user_";

    private final MetadataGateway gateway;
    private final ComputeCache computeCache;
    private final DiscoveryCacheProperties cacheProperties;
    private final PreferenceExtractor preferenceExtractor;
    private final RetrievalOrchestrator retrievalOrchestrator;
    private final RankingEngine rankingEngine;
    private final ObjectMapper objectMapper;

    public RecommendationService(
        MetadataGateway gateway,
        ComputeCache computeCache,
        DiscoveryCacheProperties cacheProperties,
        PreferenceExtractor preferenceExtractor,
        RetrievalOrchestrator retrievalOrchestrator,
        RankingEngine rankingEngine,
        ObjectMapper objectMapper
    ) {
        this.gateway = gateway;
        this.computeCache = computeCache;
        this.cacheProperties = cacheProperties;
        this.preferenceExtractor = preferenceExtractor;
        this.retrievalOrchestrator = retrievalOrchestrator;
        this.rankingEngine = rankingEngine;
        this.objectMapper = objectMapper;
    }

    public CacheResult<List<CandidateItem>> trending() {
        return computeCache.get(
            TRENDING_KEY,
            () -> UpstreamFutures.join(gateway.trending()),
            cacheProperties.getTrendingTtlMs()
        );
    }

    public RecommendationResponse guestHome() {
        CacheResult<List<CandidateItem>> trending = trending();
        return new RecommendationResponse(trending.value(), RecommendationResponse.STRATEGY_TRENDING, trending.fromCache());
    }

    /**
     * Personalized home feed. Without any history or saved items this is the trending listing; if
     * personalization fails or yields nothing, trending is served instead.
     */
    public RecommendationResponse home(
        String userId,
        List<? extends WatchHistoryItem> watchHistory,
        List<? extends WatchHistoryItem> listItems
    ) {
        List<? extends WatchHistoryItem> history = watchHistory == null ? List.of() : watchHistory;
        List<? extends WatchHistoryItem> saved = listItems == null ? List.of() : listItems;
        if (history.isEmpty() && saved.isEmpty()) {
            return guestHome();
        }

        Map<String, Object> signals = new LinkedHashMap<>();
        signals.put("watch_history", history);
        signals.put("my_list", saved);
        String key = scopedKey(userId, "home", signals);
        try {
            CacheResult<List<CandidateItem>> result = computeCache.get(
                key,
                () -> personalize(history, saved),
                cacheProperties.getRecommendationsTtlMs()
            );
            if (!result.value().isEmpty()) {
                return new RecommendationResponse(
                    result.value(),
                    RecommendationResponse.STRATEGY_PERSONALIZED,
                    result.fromCache()
                );
            }
            if (key != null) {
                computeCache.invalidate(key);
            }
            logger.warn("recommendations_empty user_id={} fallback=trending", userId);
        } catch (RuntimeException e) {
            logger.warn("recommendations_fallback user_id={} reason={}", userId, e.getMessage());
        }
        CacheResult<List<CandidateItem>> trending = trending();
        return new RecommendationResponse(trending.value(), RecommendationResponse.STRATEGY_FALLBACK, trending.fromCache());
    }

    /**
     * Recommendations anchored on one item, boosted toward the user's top genres when a watch
     * history is supplied. A missing or invalid reference item propagates.
     */
    public RecommendationResponse forItem(
        ItemKey reference,
        String userId,
        List<? extends WatchHistoryItem> watchHistory,
        List<? extends WatchHistoryItem> listItems
    ) {
        List<? extends WatchHistoryItem> history = watchHistory == null ? List.of() : watchHistory;
        List<? extends WatchHistoryItem> saved = listItems == null ? List.of() : listItems;
        String scope = "item_" + reference.mediaType().value() + "_" + reference.id();
        String key;
        if (userId == null && history.isEmpty() && saved.isEmpty()) {
            key = "recs_" + scope;
        } else {
            Map<String, Object> signals = new LinkedHashMap<>();
            signals.put("watch_history", history);
            signals.put("my_list", saved);
            key = scopedKey(userId, scope, signals);
        }
        CacheResult<List<CandidateItem>> result = computeCache.get(
            key,
            () -> rankForItem(reference, history, saved),
            cacheProperties.getRecommendationsTtlMs()
        );
        return new RecommendationResponse(result.value(), RecommendationResponse.STRATEGY_ITEM, result.fromCache());
    }

    public int invalidateUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidDiscoveryRequestException("user_id is required");
        }
        int removed = computeCache.invalidatePrefix(userPrefix(userId));
        logger.info("recommendations_invalidated user_id={} entries={}", userId, removed);
        return removed;
    }

    private List<CandidateItem> personalize(
        List<? extends WatchHistoryItem> history,
        List<? extends WatchHistoryItem> saved
    ) {
        TasteAnalysis analysis = preferenceExtractor.analyze(history, saved, gateway::details);
        List<SourceResult> sources = retrievalOrchestrator.retrieveHome(analysis, history, saved);
        RankingContext context = RankingContext.homeFeed(analysis.profile(), keys(history), keys(saved));
        return rankingEngine.rank(sources, context);
    }

    private List<CandidateItem> rankForItem(
        ItemKey reference,
        List<? extends WatchHistoryItem> history,
        List<? extends WatchHistoryItem> saved
    ) {
        ItemDetail detail = UpstreamFutures.join(gateway.details(reference));
        List<SourceResult> sources = retrievalOrchestrator.retrieve(null, detail);
        TasteProfile profile = history.isEmpty()
            ? TasteProfile.empty()
            : TasteProfile.genresOnly(preferenceExtractor.topGenres(history));
        RankingContext context = RankingContext.itemDetail(reference, profile, keys(saved));
        return rankingEngine.rank(sources, context);
    }

    private String scopedKey(String userId, String scope, Object signals) {
        String hash = CacheKeyUtil.hashJson(objectMapper, signals);
        if (hash == null) {
            return null;
        }
        if (userId == null || userId.isBlank()) {
            return "recs_anon_" + scope + "_" + hash;
        }
        return userPrefix(userId) + scope + "_" + hash;
    }

    // Hashed so that one id can never be a prefix of another user's keys.
    private static String userPrefix(String userId) {
        return USER_PREFIX + CacheKeyUtil.sha256(userId.trim()) + "_";
    }

    private static Set<ItemKey> keys(List<? extends WatchHistoryItem> items) {
        Set<ItemKey> keys = new LinkedHashSet<>();
        for (WatchHistoryItem item : items) {
            if (item != null && item.getId() > 0) {
                keys.add(item.key());
            }
        }
        return keys;
    }
}
