package com.reelhub.discovery.search;

import com.reelhub.discovery.api.dto.Pagination;
import com.reelhub.discovery.api.dto.SearchResponse;
import com.reelhub.discovery.api.dto.SuggestionsResponse;
import com.reelhub.discovery.cache.CacheKeyUtil;
import com.reelhub.discovery.cache.CacheResult;
import com.reelhub.discovery.cache.ComputeCache;
import com.reelhub.discovery.cache.DiscoveryCacheProperties;
import com.reelhub.discovery.model.CandidateItem;
import com.reelhub.discovery.model.ItemKey;
import com.reelhub.discovery.service.InvalidDiscoveryRequestException;
import com.reelhub.discovery.upstream.MetadataGateway;
import com.reelhub.discovery.upstream.TmdbClient;
import com.reelhub.discovery.upstream.TmdbConfigurationException;
import com.reelhub.discovery.upstream.UpstreamFutures;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SearchService {
    private static final Logger logger = LoggerFactory.getLogger(SearchService.class);
    private static final String NO_DATE = "1900-01-01";

    private final MetadataGateway gateway;
    private final ComputeCache computeCache;
    private final DiscoveryCacheProperties cacheProperties;
    private final SearchProperties properties;
    private final RelevanceScorer scorer;
    private final SearchQueryTracker queryTracker;

    public SearchService(
        MetadataGateway gateway,
        ComputeCache computeCache,
        DiscoveryCacheProperties cacheProperties,
        SearchProperties properties,
        RelevanceScorer scorer,
        SearchQueryTracker queryTracker
    ) {
        this.gateway = gateway;
        this.computeCache = computeCache;
        this.cacheProperties = cacheProperties;
        this.properties = properties;
        this.scorer = scorer;
        this.queryTracker = queryTracker;
    }

    /**
     * Multi-page search with filters, scoring, sorting, de-duplication and pagination. A blank
     * query returns the empty shape without calling the provider.
     */
    public CacheResult<SearchResponse> search(
        String query,
        SearchFilters filters,
        SearchSort sort,
        Integer page,
        Integer limit
    ) {
        int pageSize = resolvePageSize(limit);
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty()) {
            SearchResponse empty = new SearchResponse();
            empty.setResults(List.of());
            empty.setPagination(Pagination.empty(pageSize));
            return CacheResult.miss(empty);
        }

        int pageNumber = page == null || page < 1 ? 1 : page;
        SearchFilters resolvedFilters = filters == null ? SearchFilters.none() : filters;
        SearchSort resolvedSort = sort == null ? SearchSort.RELEVANCE : sort;
        validate(resolvedFilters);

        String key = "search_multi_" + CacheKeyUtil.normalizeQuery(trimmed)
            + resolvedFilters.cacheKeyPart()
            + "_s:" + resolvedSort.value()
            + "_p:" + pageNumber
            + "_l:" + pageSize;
        CacheResult<SearchResponse> result = computeCache.get(
            key,
            () -> execute(trimmed, resolvedFilters, resolvedSort, pageNumber, pageSize),
            cacheProperties.getSearchTtlMs()
        );
        queryTracker.track(trimmed);
        return result;
    }

    /**
     * Title suggestions for a prefix. Short input yields the most searched queries instead; a
     * provider failure yields an empty list typed {@code error}.
     */
    public CacheResult<SuggestionsResponse> suggestions(String query) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.length() < properties.getSuggestionMinLength()) {
            List<String> trending = queryTracker.trending(properties.getSuggestionLimit()).stream()
                .map(TrendingQuery::query)
                .collect(Collectors.toList());
            return CacheResult.miss(new SuggestionsResponse(trending, SuggestionsResponse.TYPE_TRENDING));
        }
        String key = "suggestions_" + CacheKeyUtil.normalizeQuery(trimmed);
        try {
            return computeCache.get(key, () -> fetchSuggestions(trimmed), cacheProperties.getSuggestionsTtlMs());
        } catch (TmdbConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warn("suggestions_failed query={} reason={}", trimmed, e.getMessage());
            return CacheResult.miss(new SuggestionsResponse(List.of(), SuggestionsResponse.TYPE_ERROR));
        }
    }

    public List<TrendingQuery> trendingQueries() {
        return queryTracker.trending(properties.getTrendingLimit());
    }

    private SearchResponse execute(String query, SearchFilters filters, SearchSort sort, int page, int pageSize) {
        long started = System.nanoTime();
        List<CandidateItem> raw = fetchPages(query, pageCount(pageSize));
        int earliestYear = properties.getEarliestYear();
        int currentYear = scorer.currentYear();

        List<ScoredHit> hits = new ArrayList<>(raw.size());
        for (CandidateItem item : raw) {
            if (item == null || item.getMediaType() == null) {
                continue;
            }
            if (!filters.matches(item, earliestYear, currentYear)) {
                continue;
            }
            hits.add(new ScoredHit(item, scorer.score(item, query)));
        }

        hits.sort(comparator(sort));
        if (sort == SearchSort.RELEVANCE) {
            hits.removeIf(hit -> hit.score <= properties.getMinRelevance());
        }

        Set<ItemKey> seen = new HashSet<>();
        List<CandidateItem> unique = new ArrayList<>(hits.size());
        for (ScoredHit hit : hits) {
            if (seen.add(hit.item.key())) {
                unique.add(hit.item);
            }
        }

        int from = Math.min((page - 1) * pageSize, unique.size());
        int to = Math.min(from + pageSize, unique.size());

        SearchResponse response = new SearchResponse();
        response.setResults(new ArrayList<>(unique.subList(from, to)));
        response.setPagination(new Pagination(page, pageSize, unique.size()));
        response.setQuery(query);
        response.setFilters(appliedFilters(filters));
        response.setSortBy(sort.value());
        response.setTookMs((System.nanoTime() - started) / 1_000_000L);
        logger.debug("search_executed query={} raw={} matched={} took_ms={}", query, raw.size(), unique.size(), response.getTookMs());
        return response;
    }

    private List<CandidateItem> fetchPages(String query, int pages) {
        List<CompletableFuture<List<CandidateItem>>> futures = new ArrayList<>(pages);
        for (int i = 1; i <= pages; i++) {
            futures.add(gateway.searchMulti(query, i));
        }

        List<CandidateItem> combined = new ArrayList<>();
        RuntimeException firstFailure = null;
        int failures = 0;
        for (int i = 0; i < futures.size(); i++) {
            try {
                combined.addAll(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw UpstreamFutures.propagate(e);
            } catch (ExecutionException e) {
                failures++;
                RuntimeException cause = UpstreamFutures.propagate(e);
                if (firstFailure == null) {
                    firstFailure = cause;
                }
                logger.warn("search_page_failed query={} page={} reason={}", query, i + 1, TmdbClient.unwrap(e).getMessage());
            }
        }
        if (failures == futures.size() && firstFailure != null) {
            throw firstFailure;
        }
        return combined;
    }

    private SuggestionsResponse fetchSuggestions(String query) {
        List<CandidateItem> items = UpstreamFutures.join(gateway.searchMulti(query, 1));
        Set<String> titles = new LinkedHashSet<>();
        items.stream()
            .filter(item -> item.getMediaType() != null)
            .filter(item -> item.getVoteCount() != null && item.getVoteCount() > properties.getSuggestionMinVotes())
            .sorted(Comparator.comparingDouble((CandidateItem item) -> value(item.getPopularity())).reversed())
            .map(CandidateItem::getTitle)
            .filter(Objects::nonNull)
            .forEach(titles::add);
        List<String> suggestions = titles.stream()
            .limit(properties.getSuggestionLimit())
            .collect(Collectors.toList());
        return new SuggestionsResponse(suggestions, SuggestionsResponse.TYPE_RESULTS);
    }

    private int pageCount(int pageSize) {
        int perPage = Math.max(1, properties.getResultsPerUpstreamPage());
        int needed = (int) Math.ceil((double) pageSize / perPage);
        return Math.max(1, Math.min(properties.getMaxPages(), needed));
    }

    private int resolvePageSize(Integer limit) {
        if (limit == null || limit < 1) {
            return properties.getDefaultPageSize();
        }
        return Math.min(limit, properties.getMaxPageSize());
    }

    private static void validate(SearchFilters filters) {
        if (filters.yearStart() != null && filters.yearEnd() != null && filters.yearStart() > filters.yearEnd()) {
            throw new InvalidDiscoveryRequestException("year_start must not be after year_end");
        }
        if (filters.minRating() != null && (filters.minRating() < 0 || filters.minRating() > 10)) {
            throw new InvalidDiscoveryRequestException("min_rating must be between 0 and 10");
        }
    }

    private static Comparator<ScoredHit> comparator(SearchSort sort) {
        switch (sort) {
            case RECENT:
                return Comparator.comparing(
                    (ScoredHit hit) -> hit.item.getReleaseDate() == null || hit.item.getReleaseDate().isBlank()
                        ? NO_DATE
                        : hit.item.getReleaseDate()
                ).reversed();
            case POPULAR:
                return Comparator.comparingDouble((ScoredHit hit) -> value(hit.item.getPopularity())).reversed();
            case RATING:
                return Comparator.comparingDouble((ScoredHit hit) -> value(hit.item.getVoteAverage())).reversed();
            case RELEVANCE:
            default:
                return Comparator.comparingDouble((ScoredHit hit) -> hit.score).reversed();
        }
    }

    private static SearchResponse.AppliedFilters appliedFilters(SearchFilters filters) {
        SearchResponse.AppliedFilters applied = new SearchResponse.AppliedFilters();
        applied.setMediaType(filters.mediaType() == null ? "all" : filters.mediaType().value());
        applied.setYearStart(filters.yearStart());
        applied.setYearEnd(filters.yearEnd());
        applied.setMinRating(filters.minRating());
        applied.setGenres(filters.genres());
        return applied;
    }

    private static double value(Double number) {
        return number == null || number.isNaN() ? 0.0 : number;
    }

    private static final class ScoredHit {
        private final CandidateItem item;
        private final double score;

        private ScoredHit(CandidateItem item, double score) {
            this.item = item;
            this.score = score;
        }
    }
}
